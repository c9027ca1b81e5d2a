package com.delta.creatoringest.ingest.service;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.checkpoint.CheckpointStore;
import com.delta.creatoringest.ingest.model.CheckpointState;
import com.delta.creatoringest.ingest.model.IngestRunSummary;
import com.delta.creatoringest.ingest.model.TaskOutcome;
import com.delta.creatoringest.ingest.persistence.InMemoryRecordSink;
import com.delta.creatoringest.ingest.persistence.IngestRunRepository;
import com.delta.creatoringest.ingest.source.HandleListReader;
import com.delta.creatoringest.ingest.source.TaskSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestRunServiceTest {

    @Mock
    private IngestRunRepository runRepository;
    @Mock
    private HandleListReader handleListReader;

    @TempDir
    Path tempDir;

    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor();
    private IngestProperties properties;
    private ScriptedChannelFetcher fetcher;
    private InMemoryRecordSink sink;
    private CheckpointStore checkpointStore;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        properties.setCallDelayMs(0);
        properties.setTaskDelayMs(0);
        properties.setMaxConcurrency(2);
        properties.getRetry().setBaseDelayMs(0);
        properties.getCheckpoint().setFlushEvery(3);
        properties.getCredentials().setApiKeys(List.of("key-a", "key-b"));
        fetcher = new ScriptedChannelFetcher();
        sink = new InMemoryRecordSink();
        checkpointStore = new CheckpointStore(tempDir.resolve("checkpoint.json"), new ObjectMapper().registerModule(new JavaTimeModule()));
        lenient().when(runRepository.insertRun(any(), anyString(), anyInt(), anyInt(), anyString())).thenReturn(41L);
    }

    @AfterEach
    void tearDown() {
        runExecutor.shutdownNow();
    }

    @Test
    void missingChannelStillAdvancesCheckpointPastIt() {
        when(handleListReader.readHandles()).thenReturn(List.of("@first", "@missing", "@third"));
        fetcher.channel("@first", "UCfirst", "f1", "f2")
            .channel("@third", "UCthird", "t1");

        IngestRunSummary summary = service().run();

        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_COMPLETED);
        assertThat(summary.exitCode()).isZero();
        assertThat(summary.checkpoint()).isEqualTo(3);
        assertThat(summary.outcomes()).containsEntry(TaskOutcome.PERSISTED, 2).containsEntry(TaskOutcome.SKIPPED_NO_ENTITY, 1);
        assertThat(checkpointStore.load()).map(CheckpointState::processedCount).contains(3);
        assertThat(sink.countForEntity("UCfirst")).isEqualTo(2);
        assertThat(sink.countForEntity("UCthird")).isEqualTo(1);
        verify(runRepository).completeRun(eq(41L), any(), eq(IngestRunService.STATUS_COMPLETED), anyString());
    }

    @Test
    void resumesFromCommittedCheckpoint() {
        when(handleListReader.readHandles()).thenReturn(List.of("@a", "@b", "@c", "@d"));
        fetcher.channel("@a", "UCa", "a1")
            .channel("@b", "UCb", "b1")
            .channel("@c", "UCc", "c1")
            .channel("@d", "UCd", "d1");
        checkpointStore.commit(2, "@b");

        IngestRunSummary summary = service().run();

        assertThat(summary.resumedFrom()).isEqualTo(2);
        assertThat(summary.checkpoint()).isEqualTo(4);
        assertThat(fetcher.resolvedHandles).containsExactlyInAnyOrder("@c", "@d");
        assertThat(sink.hasCommittedRecords("UCa")).isFalse();
        assertThat(checkpointStore.load()).map(CheckpointState::lastHandle).contains("@d");
    }

    @Test
    void stopsWithQuotaStatusWhenEveryCredentialIsExhausted() {
        when(handleListReader.readHandles()).thenReturn(List.of("@a", "@b", "@c", "@d", "@e"));
        fetcher.channel("@a", "UCa", "a1").quotaExhaustedFor(1).quotaExhaustedFor(2);

        IngestRunSummary summary = service().run();

        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_QUOTA_EXHAUSTED);
        assertThat(summary.exitCode()).isEqualTo(3);
        assertThat(summary.checkpoint()).isZero();
        assertThat(sink.size()).isZero();
        assertThat(fetcher.credentialsUsed.size()).isLessThanOrEqualTo(4);
    }

    @Test
    void reportsNoCredentialsWithoutDispatching() {
        properties.getCredentials().setApiKeys(List.of(" ", ""));
        when(handleListReader.readHandles()).thenReturn(List.of("@a"));

        IngestRunSummary summary = service().run();

        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_NO_CREDENTIALS);
        assertThat(summary.exitCode()).isEqualTo(3);
        assertThat(fetcher.credentialsUsed).isEmpty();
    }

    @Test
    void reportsNoTasksWhenCheckpointIsAtTheEnd() {
        when(handleListReader.readHandles()).thenReturn(List.of("@a", "@b"));
        checkpointStore.commit(2, "@b");

        IngestRunSummary summary = service().run();

        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_NO_TASKS);
        assertThat(summary.exitCode()).isZero();
        assertThat(summary.totalTasks()).isZero();
    }

    @Test
    void persistenceOutageIsRetriedBeforeCheckpointMoves() {
        when(handleListReader.readHandles()).thenReturn(List.of("@a", "@b", "@c"));
        fetcher.channel("@a", "UCa", "a1")
            .channel("@b", "UCb", "b1")
            .channel("@c", "UCc", "c1");
        sink.failNext(1);

        IngestRunSummary summary = service().run();

        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_COMPLETED);
        assertThat(summary.checkpoint()).isEqualTo(3);
        assertThat(sink.size()).isEqualTo(3);
    }

    @Test
    void haltsOnExhaustedRetriesWhenSkippingIsDisabled() {
        properties.getRetry().setSkipOnExhaustion(false);
        properties.getRetry().setMaxRetries(0);
        properties.setMaxConcurrency(1);
        when(handleListReader.readHandles()).thenReturn(List.of("@a", "@b", "@c"));
        fetcher.channel("@a", "UCa", "a1")
            .channel("@b", "UCb", "b1")
            .channel("@c", "UCc", "c1")
            .failResolve(ScriptedChannelFetcher.transientFailure());

        IngestRunSummary summary = service().run();

        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_HALTED_ON_FAILURE);
        assertThat(summary.exitCode()).isEqualTo(4);
        assertThat(summary.checkpoint()).isZero();
        assertThat(fetcher.resolvedHandles).isEmpty();
    }

    @Test
    void exitCodesFollowRunStatus() {
        assertThat(IngestRunService.exitCodeFor(IngestRunService.STATUS_COMPLETED_WITH_FAILURES)).isZero();
        assertThat(IngestRunService.exitCodeFor(IngestRunService.STATUS_NO_CREDENTIALS)).isEqualTo(3);
        assertThat(IngestRunService.exitCodeFor(IngestRunService.STATUS_HALTED_ON_FAILURE)).isEqualTo(4);
        assertThat(IngestRunService.exitCodeFor(IngestRunService.STATUS_FAILED)).isEqualTo(1);
        assertThat(IngestRunService.exitCodeFor(IngestRunService.STATUS_INTERRUPTED)).isEqualTo(130);
    }

    @Test
    void checkpointResetIsRefusedWhileARunIsStarting() throws Exception {
        checkpointStore.commit(1, "@a");
        CountDownLatch reading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(handleListReader.readHandles()).thenAnswer(invocation -> {
            reading.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of("@a");
        });
        IngestRunService service = service();

        Future<IngestRunSummary> run = runExecutor.submit(service::run);
        assertThat(reading.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(service::resetCheckpoint).isInstanceOf(ActiveIngestRunException.class);
        assertThat(checkpointStore.path()).exists();

        release.countDown();
        IngestRunSummary summary = run.get(5, TimeUnit.SECONDS);
        assertThat(summary.status()).isEqualTo(IngestRunService.STATUS_NO_TASKS);
        assertThat(checkpointStore.resume()).isEqualTo(1);
    }

    @Test
    void checkpointResetWhileIdleDeletesTheFile() {
        checkpointStore.commit(2, "@b");
        IngestRunService service = service();

        service.resetCheckpoint();

        assertThat(checkpointStore.load()).isEmpty();
        assertThat(service.isRunActive()).isFalse();
    }

    private IngestRunService service() {
        ChannelIngestionService ingestionService = new ChannelIngestionService(fetcher, sink, properties);
        return new IngestRunService(
            new TaskSource(handleListReader),
            checkpointStore,
            sink,
            runRepository,
            ingestionService,
            properties,
            runExecutor
        );
    }
}
