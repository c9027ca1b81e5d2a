package com.delta.creatoringest.ingest.fetch;

import java.time.Duration;
import java.time.Instant;

public record ApiResponse(
    String endpoint,
    int statusCode,
    String body,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
