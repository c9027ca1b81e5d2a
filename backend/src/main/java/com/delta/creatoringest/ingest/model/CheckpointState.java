package com.delta.creatoringest.ingest.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CheckpointState(
    @JsonProperty("processed_count") @JsonAlias("processed_rows") int processedCount,
    @JsonProperty("last_handle") String lastHandle,
    @JsonProperty("timestamp") Instant timestamp
) {}
