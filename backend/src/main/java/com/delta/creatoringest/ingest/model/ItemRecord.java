package com.delta.creatoringest.ingest.model;

/**
 * One stored video row: the listing entry joined with its statistics and the owning channel.
 */
public record ItemRecord(EntitySnapshot entity, ListingItem item, ItemStats stats) {
    public String entityId() {
        return entity.entityId();
    }

    public String itemId() {
        return item.itemId();
    }
}
