package com.delta.creatoringest.ingest.model;

public enum TaskOutcome {
    PERSISTED,
    SKIPPED_NO_ENTITY,
    SKIPPED_NO_CHILDREN,
    SKIPPED_ALREADY_PROCESSED,
    FAILED_SKIPPED,
    HALTED_NO_CREDENTIAL,
    HALTED_RETRIES_EXHAUSTED,
    /** The worker was interrupted mid-task; the run is being cancelled. */
    HALTED_INTERRUPTED;

    /** Whether the outcome counts as durably recorded once flushed, letting the checkpoint move past it. */
    public boolean isTerminal() {
        return this != HALTED_NO_CREDENTIAL && this != HALTED_RETRIES_EXHAUSTED && this != HALTED_INTERRUPTED;
    }

    public boolean haltsRun() {
        return !isTerminal();
    }
}
