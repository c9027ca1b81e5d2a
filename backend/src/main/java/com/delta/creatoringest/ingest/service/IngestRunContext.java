package com.delta.creatoringest.ingest.service;

import com.delta.creatoringest.ingest.checkpoint.CheckpointCoordinator;
import com.delta.creatoringest.ingest.credential.CredentialPool;
import com.delta.creatoringest.ingest.retry.RetryPolicy;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Objects whose lifetime is a single run, shared by all of its workers.
 */
public class IngestRunContext {
    private final long runId;
    private final CredentialPool credentialPool;
    private final RetryPolicy retryPolicy;
    private final CheckpointCoordinator coordinator;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public IngestRunContext(long runId, CredentialPool credentialPool, RetryPolicy retryPolicy, CheckpointCoordinator coordinator) {
        this.runId = runId;
        this.credentialPool = credentialPool;
        this.retryPolicy = retryPolicy;
        this.coordinator = coordinator;
    }

    public long runId() {
        return runId;
    }

    public CredentialPool credentialPool() {
        return credentialPool;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public CheckpointCoordinator coordinator() {
        return coordinator;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get() || (coordinator != null && coordinator.isHalted());
    }
}
