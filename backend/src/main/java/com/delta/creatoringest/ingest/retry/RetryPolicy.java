package com.delta.creatoringest.ingest.retry;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.credential.CredentialPool;
import com.delta.creatoringest.ingest.fetch.FetchException;
import com.delta.creatoringest.ingest.model.ApiCredential;
import com.delta.creatoringest.ingest.persistence.PersistenceException;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Single place where a failed attempt is classified and turned into the next action.
 * <p>
 * Transient failures are retried up to {@code maxRetries} times after the first attempt, with
 * exponential backoff. Quota and auth failures exhaust the credential in the pool and are retried
 * immediately without touching that budget.
 */
public class RetryPolicy {
    private final CredentialPool credentialPool;
    private final int maxRetries;
    private final int baseDelayMs;
    private final int maxDelayMs;
    private final boolean skipOnExhaustion;

    public RetryPolicy(CredentialPool credentialPool, IngestProperties.Retry retry) {
        this(credentialPool, retry.getMaxRetries(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.isSkipOnExhaustion());
    }

    public RetryPolicy(CredentialPool credentialPool, int maxRetries, int baseDelayMs, int maxDelayMs, boolean skipOnExhaustion) {
        this.credentialPool = credentialPool;
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
        this.skipOnExhaustion = skipOnExhaustion;
    }

    public FailureClassification classify(Throwable failure) {
        if (failure instanceof FetchException fetchException) {
            return fetchException.classification();
        }
        if (failure instanceof PersistenceException) {
            return FailureClassification.PERSISTENCE_ERROR;
        }
        return FailureClassification.TRANSIENT_ERROR;
    }

    /**
     * @param transientFailures transient failures of this task so far, including this one
     */
    public RetryDecision onFailure(Throwable failure, ApiCredential credential, int transientFailures) {
        FailureClassification classification = classify(failure);
        switch (classification) {
            case NOT_FOUND:
                return RetryDecision.of(RetryDecision.Action.SKIP_NO_DATA, classification);
            case QUOTA_EXHAUSTED:
            case FATAL_AUTH_ERROR:
                if (credential != null) {
                    credentialPool.markExhausted(credential.id());
                }
                return RetryDecision.of(RetryDecision.Action.ROTATE_CREDENTIAL, classification);
            default:
                return budgeted(classification, transientFailures);
        }
    }

    public RetryDecision onPersistenceFailure(int failures) {
        return budgeted(FailureClassification.PERSISTENCE_ERROR, failures);
    }

    public boolean isSkipOnExhaustion() {
        return skipOnExhaustion;
    }

    public int maxRetries() {
        return maxRetries;
    }

    long backoffDelayMs(int attempt) {
        if (baseDelayMs <= 0) {
            return 0L;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 1) {
            return delay;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }

    private RetryDecision budgeted(FailureClassification classification, int failures) {
        if (failures > maxRetries) {
            return RetryDecision.of(RetryDecision.Action.GIVE_UP, classification);
        }
        return new RetryDecision(RetryDecision.Action.RETRY_AFTER_BACKOFF, classification, backoffDelayMs(failures));
    }
}
