package com.delta.creatoringest.ingest.checkpoint;

public class CheckpointException extends RuntimeException {
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
