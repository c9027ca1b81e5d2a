package com.delta.creatoringest.ingest.model;

import java.util.List;

public record ChildPage(List<ListingItem> items, String nextPageToken) {
    public ChildPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
