package com.delta.creatoringest.ingest.model;

public record ApiCredential(int id, String secret) {
    @Override
    public String toString() {
        return "ApiCredential[id=" + id + "]";
    }
}
