package com.delta.creatoringest.ingest.model;

public record IngestStatusResponse(
    boolean dbConnectivity,
    boolean runActive,
    CheckpointState checkpoint,
    int credentialsConfigured,
    int credentialsAvailable,
    long recordCount,
    IngestRunStatus latestRun
) {}
