package com.delta.creatoringest.ingest.model;

import java.util.List;

public record TaskResult(
    IngestTask task,
    TaskOutcome outcome,
    List<ItemRecord> records,
    int attempts,
    String detail
) {
    public TaskResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static TaskResult of(IngestTask task, TaskOutcome outcome, int attempts, String detail) {
        return new TaskResult(task, outcome, List.of(), attempts, detail);
    }

    public int sequenceIndex() {
        return task.sequenceIndex();
    }
}
