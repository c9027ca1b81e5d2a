package com.delta.creatoringest.ingest.source;

public class InputSourceException extends RuntimeException {
    public InputSourceException(String message) {
        super(message);
    }

    public InputSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
