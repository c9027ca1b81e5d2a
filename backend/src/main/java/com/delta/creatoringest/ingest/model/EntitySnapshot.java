package com.delta.creatoringest.ingest.model;

import java.time.Instant;

public record EntitySnapshot(
    String entityId,
    String customHandle,
    String title,
    String description,
    long subscriberCount,
    long videoCount,
    long viewCount,
    String listingId,
    String country,
    Instant publishedAt,
    String topicCategories,
    boolean madeForKids,
    String privacyStatus
) {
    public boolean hasListing() {
        return listingId != null && !listingId.isBlank();
    }
}
