package com.delta.creatoringest.ingest.source;

import com.delta.creatoringest.ingest.model.IngestTask;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-pass queue of tasks from a resume index to the end of the handle list.
 * <p>
 * Tasks are materialised on demand. Each index is handed out once; the only re-delivery is an
 * explicit {@link #requeue(IngestTask)}, which is served ahead of fresh work.
 */
public class TaskQueue {
    private final List<String> handles;
    private final int fromIndex;
    private final AtomicInteger cursor;
    private final ConcurrentLinkedDeque<IngestTask> requeued = new ConcurrentLinkedDeque<>();

    TaskQueue(List<String> handles, int fromIndex) {
        this.handles = List.copyOf(handles);
        this.fromIndex = Math.max(0, Math.min(fromIndex, this.handles.size()));
        this.cursor = new AtomicInteger(this.fromIndex);
    }

    /**
     * Next task, or null once the list is drained. Never blocks.
     */
    public IngestTask poll() {
        IngestTask retry = requeued.pollFirst();
        if (retry != null) {
            return retry;
        }
        int index = cursor.getAndIncrement();
        if (index >= handles.size()) {
            cursor.set(handles.size());
            return null;
        }
        return new IngestTask(index, handles.get(index));
    }

    public void requeue(IngestTask task) {
        requeued.addLast(task);
    }

    public boolean hasRequeued() {
        return !requeued.isEmpty();
    }

    public int fromIndex() {
        return fromIndex;
    }

    public int totalTasks() {
        return handles.size() - fromIndex;
    }

    public int size() {
        return handles.size();
    }

    public String handleAt(int index) {
        return handles.get(index);
    }
}
