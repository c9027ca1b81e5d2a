package com.delta.creatoringest.ingest.model;

public record ItemStats(
    long likes,
    long comments,
    long views,
    String tags,
    String duration,
    String definition,
    String categoryId,
    String license,
    boolean madeForKids
) {
    /** Stats for an item the statistics call did not return. */
    public static final ItemStats EMPTY = new ItemStats(0, 0, 0, "", "", "", "", "", false);
}
