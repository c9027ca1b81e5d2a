package com.delta.creatoringest.ingest.model;

public record IngestRunStartResponse(long runId, String status, String statusUrl) {}
