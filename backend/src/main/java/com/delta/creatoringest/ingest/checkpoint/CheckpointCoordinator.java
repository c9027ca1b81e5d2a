package com.delta.creatoringest.ingest.checkpoint;

import com.delta.creatoringest.ingest.model.IngestTask;
import com.delta.creatoringest.ingest.model.ItemRecord;
import com.delta.creatoringest.ingest.model.TaskOutcome;
import com.delta.creatoringest.ingest.model.TaskResult;
import com.delta.creatoringest.ingest.persistence.RecordSink;
import com.delta.creatoringest.ingest.retry.RetryDecision;
import com.delta.creatoringest.ingest.retry.RetryPolicy;
import com.delta.creatoringest.ingest.source.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects finished tasks from all workers of one run and turns them into durable progress.
 * <p>
 * Results are buffered and written to the sink in one call per flush. The checkpoint then moves to
 * the lowest sequence index that is not yet durably recorded, so a task still in flight or waiting
 * for a retry always stays ahead of the checkpoint no matter how far later tasks got.
 * <p>
 * All state is guarded by one lock; sink writes and checkpoint commits happen under it, which
 * serialises them across workers.
 */
public class CheckpointCoordinator {
    private static final Logger log = LoggerFactory.getLogger(CheckpointCoordinator.class);

    private final CheckpointStore checkpointStore;
    private final RecordSink recordSink;
    private final TaskQueue queue;
    private final RetryPolicy retryPolicy;
    private final int flushEvery;
    private final ReentrantLock lock = new ReentrantLock();

    private final List<TaskResult> buffer = new ArrayList<>();
    private final TreeSet<Integer> durableAhead = new TreeSet<>();
    private final Map<Integer, Integer> persistenceFailures = new HashMap<>();
    private final Map<TaskOutcome, Integer> outcomes = new EnumMap<>(TaskOutcome.class);
    private int watermark;
    private int committed;
    private int tasksCompleted;
    private int tasksFailed;
    private int recordsPersisted;
    private boolean halted;

    public CheckpointCoordinator(
        CheckpointStore checkpointStore,
        RecordSink recordSink,
        TaskQueue queue,
        RetryPolicy retryPolicy,
        int flushEvery
    ) {
        this.checkpointStore = checkpointStore;
        this.recordSink = recordSink;
        this.queue = queue;
        this.retryPolicy = retryPolicy;
        this.flushEvery = Math.max(1, flushEvery);
        this.watermark = queue.fromIndex();
        this.committed = queue.fromIndex();
    }

    /**
     * Accepts a finished task. Terminal outcomes are buffered and flushed every {@code flushEvery}
     * tasks; halting outcomes are counted but never advance the checkpoint.
     *
     * @return true when this call flushed the buffer
     */
    public boolean complete(TaskResult result) {
        lock.lock();
        try {
            if (result.outcome().haltsRun()) {
                increment(result.outcome());
                halted = true;
                return false;
            }
            buffer.add(result);
            if (buffer.size() >= flushEvery) {
                flushLocked();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public void flush() {
        lock.lock();
        try {
            flushLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Final flush once every worker has exited. A checkpoint that still cannot be written here is
     * reported to the caller.
     */
    public void finish() {
        lock.lock();
        try {
            flushLocked();
            if (committed < watermark) {
                commitLocked(true);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a task back on the queue after it failed outside the normal fetch classification,
     * bounded by the same budget as persistence failures.
     */
    public void requeueAfterError(IngestTask task, String detail) {
        lock.lock();
        try {
            retryOrResolve(task, detail);
            advanceWatermark();
            commitLocked(false);
        } finally {
            lock.unlock();
        }
    }

    public boolean isHalted() {
        lock.lock();
        try {
            return halted;
        } finally {
            lock.unlock();
        }
    }

    public int checkpoint() {
        lock.lock();
        try {
            return committed;
        } finally {
            lock.unlock();
        }
    }

    public int tasksCompleted() {
        lock.lock();
        try {
            return tasksCompleted;
        } finally {
            lock.unlock();
        }
    }

    public int tasksFailed() {
        lock.lock();
        try {
            return tasksFailed;
        } finally {
            lock.unlock();
        }
    }

    public int recordsPersisted() {
        lock.lock();
        try {
            return recordsPersisted;
        } finally {
            lock.unlock();
        }
    }

    public Map<TaskOutcome, Integer> outcomes() {
        lock.lock();
        try {
            return Map.copyOf(outcomes);
        } finally {
            lock.unlock();
        }
    }

    private void flushLocked() {
        if (buffer.isEmpty()) {
            return;
        }
        List<TaskResult> batch = new ArrayList<>(buffer);
        buffer.clear();
        List<ItemRecord> records = new ArrayList<>();
        for (TaskResult result : batch) {
            records.addAll(result.records());
        }
        try {
            recordSink.upsert(records);
        } catch (RuntimeException e) {
            // the buffer is already cleared, so every task in the batch must be re-queued or resolved here
            log.warn("Persisting {} records for {} tasks failed; tasks go back on the queue", records.size(), batch.size(), e);
            for (TaskResult result : batch) {
                retryOrResolve(result.task(), "persistence_error");
            }
            advanceWatermark();
            commitLocked(false);
            return;
        }
        for (TaskResult result : batch) {
            markDurable(result.sequenceIndex(), result.outcome());
            recordsPersisted += result.records().size();
        }
        advanceWatermark();
        commitLocked(false);
    }

    private void retryOrResolve(IngestTask task, String detail) {
        int failures = persistenceFailures.merge(task.sequenceIndex(), 1, Integer::sum);
        RetryDecision decision = retryPolicy.onPersistenceFailure(failures);
        if (decision.action() == RetryDecision.Action.RETRY_AFTER_BACKOFF) {
            log.info("Re-queueing task {} ({}) after {} failure(s): {}", task.sequenceIndex(), task.normalizedHandle(), failures, detail);
            queue.requeue(task);
            return;
        }
        if (retryPolicy.isSkipOnExhaustion()) {
            log.warn("Task {} ({}) skipped after {} failures: {}", task.sequenceIndex(), task.normalizedHandle(), failures, detail);
            markDurable(task.sequenceIndex(), TaskOutcome.FAILED_SKIPPED);
            return;
        }
        log.warn("Task {} ({}) exhausted its retries ({}); halting run", task.sequenceIndex(), task.normalizedHandle(), detail);
        increment(TaskOutcome.HALTED_RETRIES_EXHAUSTED);
        halted = true;
    }

    private void markDurable(int index, TaskOutcome outcome) {
        durableAhead.add(index);
        persistenceFailures.remove(index);
        increment(outcome);
        tasksCompleted++;
        if (outcome == TaskOutcome.FAILED_SKIPPED) {
            tasksFailed++;
        }
    }

    private void advanceWatermark() {
        while (!durableAhead.isEmpty() && durableAhead.first() == watermark) {
            durableAhead.pollFirst();
            watermark++;
        }
    }

    private void commitLocked(boolean rethrow) {
        if (watermark <= committed) {
            return;
        }
        try {
            checkpointStore.commit(watermark, queue.handleAt(watermark - 1));
            committed = watermark;
            log.info("Checkpoint advanced to {} ({} tasks completed, {} records)", committed, tasksCompleted, recordsPersisted);
        } catch (CheckpointException e) {
            if (rethrow) {
                throw e;
            }
            log.error("Checkpoint write failed at {}; will retry on next flush", watermark, e);
        }
    }

    private void increment(TaskOutcome outcome) {
        outcomes.merge(outcome, 1, Integer::sum);
    }
}
