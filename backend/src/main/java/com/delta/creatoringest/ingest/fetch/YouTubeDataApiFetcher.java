package com.delta.creatoringest.ingest.fetch;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.model.ApiCredential;
import com.delta.creatoringest.ingest.model.ChildPage;
import com.delta.creatoringest.ingest.model.EntitySnapshot;
import com.delta.creatoringest.ingest.model.ItemStats;
import com.delta.creatoringest.ingest.model.ListingItem;
import com.delta.creatoringest.ingest.retry.FailureClassification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class YouTubeDataApiFetcher implements ChannelFetcher {
    private static final Logger log = LoggerFactory.getLogger(YouTubeDataApiFetcher.class);
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";
    private static final int MAX_IDS_PER_CALL = 50;

    private final ApiHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final IngestProperties properties;

    public YouTubeDataApiFetcher(ApiHttpClient httpClient, ObjectMapper objectMapper, IngestProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Optional<String> resolve(String handle, ApiCredential credential) {
        String bare = stripAt(handle);
        if (bare.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "id");
        params.put("forHandle", "@" + bare);
        JsonNode items = call("channels", params, credential).path("items");
        if (items.isArray() && items.size() > 0) {
            String id = items.get(0).path("id").asText("");
            if (!id.isBlank()) {
                return Optional.of(id);
            }
        }
        if (!properties.getFetch().isSearchFallback()) {
            return Optional.empty();
        }
        log.debug("Handle {} not matched directly, falling back to search", bare);
        Map<String, String> search = new LinkedHashMap<>();
        search.put("part", "snippet");
        search.put("type", "channel");
        search.put("maxResults", "1");
        search.put("q", bare);
        JsonNode results = call("search", search, credential).path("items");
        if (!results.isArray() || results.size() == 0) {
            return Optional.empty();
        }
        JsonNode first = results.get(0);
        String channelId = first.path("id").path("channelId").asText("");
        if (channelId.isBlank()) {
            channelId = first.path("snippet").path("channelId").asText("");
        }
        return channelId.isBlank() ? Optional.empty() : Optional.of(channelId);
    }

    @Override
    public Optional<EntitySnapshot> fetchEntity(String entityId, ApiCredential credential) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet,statistics,contentDetails,topicDetails,status");
        params.put("id", entityId);
        JsonNode items = call("channels", params, credential).path("items");
        if (!items.isArray() || items.size() == 0) {
            return Optional.empty();
        }
        JsonNode channel = items.get(0);
        JsonNode snippet = channel.path("snippet");
        JsonNode statistics = channel.path("statistics");
        JsonNode status = channel.path("status");
        List<String> topics = new ArrayList<>();
        for (JsonNode topic : channel.path("topicDetails").path("topicCategories")) {
            topics.add(topic.asText());
        }
        return Optional.of(new EntitySnapshot(
            channel.path("id").asText(entityId),
            snippet.path("customUrl").asText(""),
            snippet.path("title").asText(""),
            truncate(snippet.path("description").asText("")),
            asLong(statistics.path("subscriberCount")),
            asLong(statistics.path("videoCount")),
            asLong(statistics.path("viewCount")),
            channel.path("contentDetails").path("relatedPlaylists").path("uploads").asText(null),
            snippet.path("country").asText(null),
            parseInstant(snippet.path("publishedAt").asText(null)),
            String.join("|", topics),
            status.path("madeForKids").asBoolean(false),
            status.path("privacyStatus").asText(null)
        ));
    }

    @Override
    public ChildPage fetchChildren(String listingId, String pageToken, ApiCredential credential) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet,contentDetails");
        params.put("playlistId", listingId);
        params.put("maxResults", Integer.toString(properties.getFetch().getPageSize()));
        params.put("pageToken", pageToken);
        JsonNode root = call("playlistItems", params, credential);
        List<ListingItem> items = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            JsonNode snippet = item.path("snippet");
            String videoId = item.path("contentDetails").path("videoId").asText("");
            if (videoId.isBlank()) {
                videoId = snippet.path("resourceId").path("videoId").asText("");
            }
            if (videoId.isBlank()) {
                continue;
            }
            items.add(new ListingItem(
                videoId,
                snippet.path("title").asText(""),
                truncate(snippet.path("description").asText("")),
                parseInstant(snippet.path("publishedAt").asText(null)),
                WATCH_URL + videoId,
                snippet.path("channelTitle").asText("")
            ));
        }
        String next = root.path("nextPageToken").asText("");
        return new ChildPage(items, next.isBlank() ? null : next);
    }

    @Override
    public Map<String, ItemStats> fetchStats(List<String> itemIds, ApiCredential credential) {
        Map<String, ItemStats> out = new LinkedHashMap<>();
        if (itemIds == null || itemIds.isEmpty()) {
            return out;
        }
        if (itemIds.size() > MAX_IDS_PER_CALL) {
            throw new IllegalArgumentException("At most " + MAX_IDS_PER_CALL + " ids per statistics call, got " + itemIds.size());
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "statistics,snippet,contentDetails,status");
        params.put("id", String.join(",", itemIds));
        params.put("maxResults", Integer.toString(MAX_IDS_PER_CALL));
        JsonNode root = call("videos", params, credential);
        for (JsonNode video : root.path("items")) {
            String id = video.path("id").asText("");
            if (id.isBlank()) {
                continue;
            }
            JsonNode statistics = video.path("statistics");
            JsonNode snippet = video.path("snippet");
            JsonNode details = video.path("contentDetails");
            List<String> tags = new ArrayList<>();
            for (JsonNode tag : snippet.path("tags")) {
                tags.add(tag.asText());
            }
            out.put(id, new ItemStats(
                asLong(statistics.path("likeCount")),
                asLong(statistics.path("commentCount")),
                asLong(statistics.path("viewCount")),
                String.join(",", tags),
                details.path("duration").asText(""),
                details.path("definition").asText(""),
                snippet.path("categoryId").asText(""),
                video.path("status").path("license").asText(""),
                video.path("status").path("madeForKids").asBoolean(false)
            ));
        }
        return out;
    }

    private JsonNode call(String resource, Map<String, String> params, ApiCredential credential) {
        ApiResponse response = httpClient.get(resource, params, credential == null ? null : credential.secret());
        if (!response.isSuccessful()) {
            FetchException failure = ApiErrorClassifier.toException(response, readQuietly(response.body()));
            log.debug(
                "{} call failed with credential {}: {} ({})",
                resource,
                credential == null ? "-" : credential.id(),
                failure.classification(),
                failure.reason()
            );
            throw failure;
        }
        if (response.body() == null || response.body().isBlank()) {
            throw new FetchException(FailureClassification.TRANSIENT_ERROR, response.statusCode(),
                ApiErrorClassifier.MALFORMED_RESPONSE, response.endpoint() + " returned an empty body");
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw ApiErrorClassifier.malformed(response, e);
        }
    }

    private JsonNode readQuietly(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String truncate(String value) {
        int max = properties.getFetch().getDescriptionMaxLength();
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    static String stripAt(String handle) {
        if (handle == null) {
            return "";
        }
        String trimmed = handle.trim();
        while (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.trim();
    }

    private static long asLong(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0L;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText("0").trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
