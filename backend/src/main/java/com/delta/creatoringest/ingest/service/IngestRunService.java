package com.delta.creatoringest.ingest.service;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.checkpoint.CheckpointCoordinator;
import com.delta.creatoringest.ingest.checkpoint.CheckpointStore;
import com.delta.creatoringest.ingest.credential.CredentialPool;
import com.delta.creatoringest.ingest.model.IngestRunSummary;
import com.delta.creatoringest.ingest.model.IngestTask;
import com.delta.creatoringest.ingest.model.TaskOutcome;
import com.delta.creatoringest.ingest.model.TaskResult;
import com.delta.creatoringest.ingest.persistence.IngestRunRepository;
import com.delta.creatoringest.ingest.persistence.RecordSink;
import com.delta.creatoringest.ingest.retry.RetryPolicy;
import com.delta.creatoringest.ingest.source.TaskQueue;
import com.delta.creatoringest.ingest.source.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class IngestRunService {
    private static final Logger log = LoggerFactory.getLogger(IngestRunService.class);

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";
    public static final String STATUS_QUOTA_EXHAUSTED = "QUOTA_EXHAUSTED";
    public static final String STATUS_HALTED_ON_FAILURE = "HALTED_ON_FAILURE";
    public static final String STATUS_NO_TASKS = "NO_TASKS";
    public static final String STATUS_NO_CREDENTIALS = "NO_CREDENTIALS";
    public static final String STATUS_INTERRUPTED = "INTERRUPTED";
    public static final String STATUS_FAILED = "FAILED";

    private final TaskSource taskSource;
    private final CheckpointStore checkpointStore;
    private final RecordSink recordSink;
    private final IngestRunRepository runRepository;
    private final ChannelIngestionService ingestionService;
    private final IngestProperties properties;
    private final ExecutorService ingestRunExecutor;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicReference<IngestRunContext> currentRun = new AtomicReference<>();

    public IngestRunService(
        TaskSource taskSource,
        CheckpointStore checkpointStore,
        RecordSink recordSink,
        IngestRunRepository runRepository,
        ChannelIngestionService ingestionService,
        IngestProperties properties,
        @Qualifier("ingestRunExecutor") ExecutorService ingestRunExecutor
    ) {
        this.taskSource = taskSource;
        this.checkpointStore = checkpointStore;
        this.recordSink = recordSink;
        this.runRepository = runRepository;
        this.ingestionService = ingestionService;
        this.properties = properties;
        this.ingestRunExecutor = ingestRunExecutor;
    }

    public IngestRunSummary run() {
        acquireRunSlot();
        try {
            PreparedRun prepared = prepare();
            return execute(prepared);
        } finally {
            releaseRunSlot();
        }
    }

    public long startAsync() {
        acquireRunSlot();
        PreparedRun prepared;
        try {
            prepared = prepare();
        } catch (RuntimeException e) {
            releaseRunSlot();
            throw e;
        }
        ingestRunExecutor.submit(() -> {
            try {
                execute(prepared);
            } finally {
                releaseRunSlot();
            }
        });
        return prepared.runId();
    }

    /**
     * Deletes the checkpoint while holding the run slot, so no run can start against it mid-reset.
     */
    public void resetCheckpoint() {
        acquireRunSlot();
        try {
            checkpointStore.reset();
        } finally {
            releaseRunSlot();
        }
    }

    public boolean isRunActive() {
        return active.get();
    }

    public Optional<IngestRunContext> currentRun() {
        return Optional.ofNullable(currentRun.get());
    }

    static int exitCodeFor(String status) {
        switch (status) {
            case STATUS_COMPLETED:
            case STATUS_COMPLETED_WITH_FAILURES:
            case STATUS_NO_TASKS:
                return 0;
            case STATUS_QUOTA_EXHAUSTED:
            case STATUS_NO_CREDENTIALS:
                return 3;
            case STATUS_HALTED_ON_FAILURE:
                return 4;
            case STATUS_INTERRUPTED:
                return 130;
            default:
                return 1;
        }
    }

    private void acquireRunSlot() {
        if (!active.compareAndSet(false, true)) {
            IngestRunContext running = currentRun.get();
            throw new ActiveIngestRunException(
                "Active ingest run in progress" + (running == null ? "" : " (id=" + running.runId() + ")")
            );
        }
    }

    private void releaseRunSlot() {
        currentRun.set(null);
        active.set(false);
    }

    private PreparedRun prepare() {
        int resumeIndex = checkpointStore.resume();
        TaskQueue queue = taskSource.nextBatch(resumeIndex);
        Instant startedAt = Instant.now();
        long runId = runRepository.insertRun(
            startedAt,
            STATUS_RUNNING,
            queue.fromIndex(),
            queue.totalTasks(),
            "ingest started at index " + queue.fromIndex()
        );
        log.info("Ingest run {} starting at index {} of {}", runId, queue.fromIndex(), queue.size());
        return new PreparedRun(runId, startedAt, queue);
    }

    private IngestRunSummary execute(PreparedRun prepared) {
        TaskQueue queue = prepared.queue();
        CredentialPool credentialPool = CredentialPool.fromSecrets(properties.getCredentials().getApiKeys());
        RetryPolicy retryPolicy = new RetryPolicy(credentialPool, properties.getRetry());
        CheckpointCoordinator coordinator = new CheckpointCoordinator(
            checkpointStore,
            recordSink,
            queue,
            retryPolicy,
            properties.getCheckpoint().getFlushEvery()
        );
        IngestRunContext context = new IngestRunContext(prepared.runId(), credentialPool, retryPolicy, coordinator);
        currentRun.set(context);

        String status = STATUS_FAILED;
        String notes = "ingest_failed";
        Instant finishedAt = null;
        try {
            if (queue.totalTasks() == 0) {
                status = STATUS_NO_TASKS;
                notes = "nothing left after index " + queue.fromIndex();
            } else if (credentialPool.size() == 0) {
                status = STATUS_NO_CREDENTIALS;
                notes = "no API keys configured";
            } else {
                do {
                    runWorkers(context, queue);
                    coordinator.flush();
                } while (!context.isStopRequested() && queue.hasRequeued() && !credentialPool.allExhausted());
                coordinator.finish();
                status = resolveStatus(coordinator, queue, credentialPool);
                notes = "checkpoint=" + coordinator.checkpoint()
                    + " completed=" + coordinator.tasksCompleted()
                    + " failed=" + coordinator.tasksFailed()
                    + " records=" + coordinator.recordsPersisted();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ingest run {} interrupted", prepared.runId());
            status = STATUS_INTERRUPTED;
            notes = "interrupted at checkpoint " + coordinator.checkpoint();
        } catch (Exception e) {
            log.warn("Ingest run {} failed", prepared.runId(), e);
            status = STATUS_FAILED;
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            finishedAt = Instant.now();
            updateProgress(context);
            runRepository.completeRun(prepared.runId(), finishedAt, status, notes);
        }
        int exitCode = exitCodeFor(status);
        log.info(
            "Ingest run {} finished with status {} (checkpoint {}, {} tasks, {} records)",
            prepared.runId(),
            status,
            coordinator.checkpoint(),
            coordinator.tasksCompleted(),
            coordinator.recordsPersisted()
        );
        Map<TaskOutcome, Integer> outcomes = new EnumMap<>(TaskOutcome.class);
        outcomes.putAll(coordinator.outcomes());
        return new IngestRunSummary(
            prepared.runId(),
            prepared.startedAt(),
            finishedAt,
            status,
            queue.fromIndex(),
            coordinator.checkpoint(),
            queue.totalTasks(),
            coordinator.tasksCompleted(),
            coordinator.recordsPersisted(),
            outcomes,
            exitCode
        );
    }

    private void runWorkers(IngestRunContext context, TaskQueue queue) throws InterruptedException {
        int workerCount = Math.min(context.credentialPool().availableCount(), properties.getMaxConcurrency());
        if (workerCount <= 0) {
            return;
        }
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("ingest-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                futures.add(executor.submit(() -> workerLoop(workerIndex, context, queue)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.warn("Ingest worker ended abnormally in run {}", context.runId(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            context.requestStop();
            executor.shutdownNow();
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    private void workerLoop(int workerIndex, IngestRunContext context, TaskQueue queue) {
        CheckpointCoordinator coordinator = context.coordinator();
        while (!context.isStopRequested() && !Thread.currentThread().isInterrupted()) {
            IngestTask task = queue.poll();
            if (task == null) {
                return;
            }
            boolean flushed = false;
            try {
                TaskResult result = ingestionService.process(task, context);
                flushed = coordinator.complete(result);
                if (result.outcome().haltsRun()) {
                    log.warn("Worker {} stopping run {}: task {} ended {}", workerIndex, context.runId(), task.sequenceIndex(), result.outcome());
                    context.requestStop();
                }
            } catch (RuntimeException e) {
                log.warn("Worker {} failed on task {} ({})", workerIndex, task.sequenceIndex(), task.normalizedHandle(), e);
                coordinator.requeueAfterError(task, e.getClass().getSimpleName());
            }
            if (flushed) {
                updateProgress(context);
            }
            if (!sleep(properties.getTaskDelayMs())) {
                return;
            }
        }
    }

    private String resolveStatus(CheckpointCoordinator coordinator, TaskQueue queue, CredentialPool credentialPool) {
        Map<TaskOutcome, Integer> outcomes = coordinator.outcomes();
        if (outcomes.containsKey(TaskOutcome.HALTED_INTERRUPTED)) {
            return STATUS_INTERRUPTED;
        }
        if (outcomes.containsKey(TaskOutcome.HALTED_NO_CREDENTIAL)) {
            return STATUS_QUOTA_EXHAUSTED;
        }
        if (outcomes.containsKey(TaskOutcome.HALTED_RETRIES_EXHAUSTED)) {
            return STATUS_HALTED_ON_FAILURE;
        }
        if (coordinator.checkpoint() < queue.size()) {
            return credentialPool.allExhausted() ? STATUS_QUOTA_EXHAUSTED : STATUS_HALTED_ON_FAILURE;
        }
        return coordinator.tasksFailed() > 0 ? STATUS_COMPLETED_WITH_FAILURES : STATUS_COMPLETED;
    }

    private void updateProgress(IngestRunContext context) {
        CheckpointCoordinator coordinator = context.coordinator();
        try {
            runRepository.updateRunProgress(
                context.runId(),
                coordinator.checkpoint(),
                coordinator.tasksCompleted(),
                coordinator.tasksFailed(),
                coordinator.recordsPersisted()
            );
        } catch (RuntimeException e) {
            log.warn("Could not record progress for ingest run {}", context.runId(), e);
        }
    }

    private boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record PreparedRun(long runId, Instant startedAt, TaskQueue queue) {}
}
