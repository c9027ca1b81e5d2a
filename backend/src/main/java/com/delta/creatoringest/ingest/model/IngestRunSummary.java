package com.delta.creatoringest.ingest.model;

import java.time.Instant;
import java.util.Map;

public record IngestRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int resumedFrom,
    int checkpoint,
    int totalTasks,
    int tasksCompleted,
    int recordsPersisted,
    Map<TaskOutcome, Integer> outcomes,
    int exitCode
) {}
