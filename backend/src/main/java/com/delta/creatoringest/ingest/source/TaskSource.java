package com.delta.creatoringest.ingest.source;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TaskSource {
    private final HandleListReader handleListReader;

    public TaskSource(HandleListReader handleListReader) {
        this.handleListReader = handleListReader;
    }

    public TaskQueue nextBatch(int fromIndex) {
        return nextBatch(handleListReader.readHandles(), fromIndex);
    }

    public TaskQueue nextBatch(List<String> handles, int fromIndex) {
        return new TaskQueue(handles, fromIndex);
    }
}
