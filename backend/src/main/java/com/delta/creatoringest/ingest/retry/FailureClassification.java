package com.delta.creatoringest.ingest.retry;

public enum FailureClassification {
    SUCCESS,
    NOT_FOUND,
    TRANSIENT_ERROR,
    QUOTA_EXHAUSTED,
    FATAL_AUTH_ERROR,
    PERSISTENCE_ERROR;

    public boolean exhaustsCredential() {
        return this == QUOTA_EXHAUSTED || this == FATAL_AUTH_ERROR;
    }
}
