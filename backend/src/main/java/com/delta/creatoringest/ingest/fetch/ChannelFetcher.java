package com.delta.creatoringest.ingest.fetch;

import com.delta.creatoringest.ingest.model.ApiCredential;
import com.delta.creatoringest.ingest.model.ChildPage;
import com.delta.creatoringest.ingest.model.EntitySnapshot;
import com.delta.creatoringest.ingest.model.ItemStats;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the upstream API. Implementations throw {@link FetchException} for anything
 * that is not a clean answer; "does not exist" is reported as an empty result where the call
 * shape allows it.
 */
public interface ChannelFetcher {

    Optional<String> resolve(String handle, ApiCredential credential);

    Optional<EntitySnapshot> fetchEntity(String entityId, ApiCredential credential);

    ChildPage fetchChildren(String listingId, String pageToken, ApiCredential credential);

    /** At most 50 ids per call. Ids the API does not know are simply absent from the map. */
    Map<String, ItemStats> fetchStats(List<String> itemIds, ApiCredential credential);
}
