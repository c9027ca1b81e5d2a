package com.delta.creatoringest.ingest.persistence;

import com.delta.creatoringest.ingest.model.ItemRecord;

import java.util.List;

/**
 * Durable destination for merged item records.
 */
public interface RecordSink {

    /**
     * Inserts or updates every record, keyed by (entity id, item id), all or nothing.
     *
     * @throws PersistenceException when the batch could not be written; nothing from it is kept
     */
    void upsert(List<ItemRecord> records);

    boolean hasCommittedRecords(String entityId);
}
