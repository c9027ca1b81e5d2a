package com.delta.creatoringest.ingest.fetch;

import com.delta.creatoringest.ingest.retry.FailureClassification;

public class FetchException extends RuntimeException {
    private final FailureClassification classification;
    private final int httpStatus;
    private final String reason;

    public FetchException(FailureClassification classification, int httpStatus, String reason, String message) {
        super(message);
        this.classification = classification;
        this.httpStatus = httpStatus;
        this.reason = reason;
    }

    public FetchException(FailureClassification classification, String reason, String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.httpStatus = 0;
        this.reason = reason;
    }

    public FailureClassification classification() {
        return classification;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String reason() {
        return reason;
    }
}
