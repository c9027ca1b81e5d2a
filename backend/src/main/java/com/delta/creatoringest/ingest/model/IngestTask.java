package com.delta.creatoringest.ingest.model;

public record IngestTask(int sequenceIndex, String entityHandle) {
    public String normalizedHandle() {
        if (entityHandle == null) {
            return "";
        }
        return entityHandle.trim();
    }
}
