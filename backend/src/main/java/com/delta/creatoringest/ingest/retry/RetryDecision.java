package com.delta.creatoringest.ingest.retry;

public record RetryDecision(Action action, FailureClassification classification, long delayMs) {

    public enum Action {
        /** Target is missing; the task completes without data. */
        SKIP_NO_DATA,
        /** Sleep {@code delayMs}, then run the task again with the same budget bookkeeping. */
        RETRY_AFTER_BACKOFF,
        /** Credential was exhausted; run again at once with the next one. */
        ROTATE_CREDENTIAL,
        /** Retry budget spent. */
        GIVE_UP
    }

    static RetryDecision of(Action action, FailureClassification classification) {
        return new RetryDecision(action, classification, 0L);
    }
}
