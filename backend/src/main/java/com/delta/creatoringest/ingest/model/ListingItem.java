package com.delta.creatoringest.ingest.model;

import java.time.Instant;

public record ListingItem(
    String itemId,
    String title,
    String description,
    Instant publishedAt,
    String url,
    String channelTitle
) {}
