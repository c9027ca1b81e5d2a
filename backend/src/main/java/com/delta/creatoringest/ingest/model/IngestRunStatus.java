package com.delta.creatoringest.ingest.model;

import java.time.Instant;

public record IngestRunStatus(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int resumedFrom,
    int checkpoint,
    int tasksCompleted,
    int recordsPersisted,
    int tasksFailed,
    String notes
) {}
