package com.delta.creatoringest.ingest.fetch;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.model.ApiCredential;
import com.delta.creatoringest.ingest.model.ChildPage;
import com.delta.creatoringest.ingest.model.EntitySnapshot;
import com.delta.creatoringest.ingest.model.ItemStats;
import com.delta.creatoringest.ingest.retry.FailureClassification;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class YouTubeDataApiFetcherTest {
    private static final ApiCredential CREDENTIAL = new ApiCredential(1, "secret-key-123");

    private MockWebServer server;
    private IngestProperties properties;
    private YouTubeDataApiFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new IngestProperties();
        properties.getApi().setBaseUrl(server.url("/youtube/v3").toString());
        properties.setRequestTimeoutSeconds(5);
        properties.getFetch().setDescriptionMaxLength(10);
        ApiHttpClient httpClient = new ApiHttpClient(properties, HttpClient.newHttpClient());
        fetcher = new YouTubeDataApiFetcher(httpClient, new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void resolvesHandleDirectly() throws Exception {
        enqueueJson("{\"items\":[{\"id\":\"UC123\"}]}");

        Optional<String> resolved = fetcher.resolve("@creator", CREDENTIAL);

        assertThat(resolved).contains("UC123");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/youtube/v3/channels");
        assertThat(request.getRequestUrl().queryParameter("forHandle")).isEqualTo("@creator");
        assertThat(request.getRequestUrl().queryParameter("key")).isEqualTo("secret-key-123");
        assertThat(request.getHeader("User-Agent")).startsWith("creator-ingest/0.1");
    }

    @Test
    void fallsBackToSearchWhenHandleLookupIsEmpty() throws Exception {
        enqueueJson("{\"items\":[]}");
        enqueueJson("{\"items\":[{\"id\":{\"kind\":\"youtube#channel\",\"channelId\":\"UCfound\"}}]}");

        Optional<String> resolved = fetcher.resolve("@@creator", CREDENTIAL);

        assertThat(resolved).contains("UCfound");
        server.takeRequest();
        RecordedRequest search = server.takeRequest();
        assertThat(search.getRequestUrl().encodedPath()).isEqualTo("/youtube/v3/search");
        assertThat(search.getRequestUrl().queryParameter("q")).isEqualTo("creator");
        assertThat(search.getRequestUrl().queryParameter("type")).isEqualTo("channel");
    }

    @Test
    void unresolvedWithoutSearchFallback() {
        properties.getFetch().setSearchFallback(false);
        enqueueJson("{\"items\":[]}");

        assertThat(fetcher.resolve("@ghost", CREDENTIAL)).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void blankHandleMakesNoCall() {
        assertThat(fetcher.resolve(" @ ", CREDENTIAL)).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void parsesChannelDetails() {
        enqueueJson("""
            {"items":[{
              "id":"UC123",
              "snippet":{"title":"Creator","description":"A very long description","customUrl":"@creator",
                         "publishedAt":"2015-03-01T12:00:00Z","country":"US"},
              "statistics":{"subscriberCount":"1500","videoCount":"42","viewCount":"99000"},
              "contentDetails":{"relatedPlaylists":{"uploads":"UU123"}},
              "topicDetails":{"topicCategories":["https://en.wikipedia.org/wiki/Music","https://en.wikipedia.org/wiki/Pop_music"]},
              "status":{"privacyStatus":"public","madeForKids":false}
            }]}
            """);

        EntitySnapshot entity = fetcher.fetchEntity("UC123", CREDENTIAL).orElseThrow();

        assertThat(entity.entityId()).isEqualTo("UC123");
        assertThat(entity.customHandle()).isEqualTo("@creator");
        assertThat(entity.description()).isEqualTo("A very lon");
        assertThat(entity.subscriberCount()).isEqualTo(1500);
        assertThat(entity.videoCount()).isEqualTo(42);
        assertThat(entity.viewCount()).isEqualTo(99000);
        assertThat(entity.listingId()).isEqualTo("UU123");
        assertThat(entity.publishedAt()).isEqualTo(Instant.parse("2015-03-01T12:00:00Z"));
        assertThat(entity.topicCategories())
            .isEqualTo("https://en.wikipedia.org/wiki/Music|https://en.wikipedia.org/wiki/Pop_music");
        assertThat(entity.privacyStatus()).isEqualTo("public");
        assertThat(entity.hasListing()).isTrue();
    }

    @Test
    void missingChannelIsEmpty() {
        enqueueJson("{\"kind\":\"youtube#channelListResponse\"}");

        assertThat(fetcher.fetchEntity("UCnone", CREDENTIAL)).isEmpty();
    }

    @Test
    void readsOnePageOfUploads() throws Exception {
        enqueueJson("""
            {"nextPageToken":"PAGE2","items":[
              {"snippet":{"title":"First","publishedAt":"2024-01-02T00:00:00Z","channelTitle":"Creator"},
               "contentDetails":{"videoId":"v1"}},
              {"snippet":{"title":"Second","resourceId":{"videoId":"v2"}}},
              {"snippet":{"title":"Deleted video"}}
            ]}
            """);

        ChildPage page = fetcher.fetchChildren("UU123", null, CREDENTIAL);

        assertThat(page.items()).extracting(item -> item.itemId()).containsExactly("v1", "v2");
        assertThat(page.items().get(0).url()).isEqualTo("https://www.youtube.com/watch?v=v1");
        assertThat(page.items().get(0).channelTitle()).isEqualTo("Creator");
        assertThat(page.nextPageToken()).isEqualTo("PAGE2");
        assertThat(page.hasNext()).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().queryParameter("playlistId")).isEqualTo("UU123");
        assertThat(request.getRequestUrl().queryParameter("maxResults")).isEqualTo("50");
        assertThat(request.getRequestUrl().queryParameter("pageToken")).isNull();
    }

    @Test
    void lastPageHasNoNextToken() throws Exception {
        enqueueJson("{\"nextPageToken\":\"\",\"items\":[]}");

        ChildPage page = fetcher.fetchChildren("UU123", "PAGE9", CREDENTIAL);

        assertThat(page.items()).isEmpty();
        assertThat(page.hasNext()).isFalse();
        assertThat(server.takeRequest().getRequestUrl().queryParameter("pageToken")).isEqualTo("PAGE9");
    }

    @Test
    void readsVideoStatistics() throws Exception {
        enqueueJson("""
            {"items":[{
              "id":"v1",
              "statistics":{"viewCount":"1000","likeCount":"50","commentCount":"7"},
              "snippet":{"tags":["music","live"],"categoryId":"10"},
              "contentDetails":{"duration":"PT4M13S","definition":"hd"},
              "status":{"license":"youtube","madeForKids":true}
            }]}
            """);

        Map<String, ItemStats> stats = fetcher.fetchStats(List.of("v1", "v2"), CREDENTIAL);

        assertThat(stats).containsOnlyKeys("v1");
        ItemStats v1 = stats.get("v1");
        assertThat(v1.views()).isEqualTo(1000);
        assertThat(v1.likes()).isEqualTo(50);
        assertThat(v1.comments()).isEqualTo(7);
        assertThat(v1.tags()).isEqualTo("music,live");
        assertThat(v1.duration()).isEqualTo("PT4M13S");
        assertThat(v1.definition()).isEqualTo("hd");
        assertThat(v1.categoryId()).isEqualTo("10");
        assertThat(v1.license()).isEqualTo("youtube");
        assertThat(v1.madeForKids()).isTrue();
        assertThat(server.takeRequest().getRequestUrl().queryParameter("id")).isEqualTo("v1,v2");
    }

    @Test
    void statisticsCallIsLimitedToFiftyIds() {
        List<String> ids = IntStream.range(0, 51).mapToObj(i -> "v" + i).toList();

        assertThatThrownBy(() -> fetcher.fetchStats(ids, CREDENTIAL)).isInstanceOf(IllegalArgumentException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void quotaErrorIsClassifiedWithoutLeakingTheKey() {
        enqueueError(403, "quotaExceeded");

        FetchException failure = catchThrowableOfType(() -> fetcher.fetchEntity("UC123", CREDENTIAL), FetchException.class);

        assertThat(failure.classification()).isEqualTo(FailureClassification.QUOTA_EXHAUSTED);
        assertThat(failure.httpStatus()).isEqualTo(403);
        assertThat(failure.reason()).isEqualTo("quotaExceeded");
        assertThat(failure.getMessage()).doesNotContain("secret-key-123");
    }

    @Test
    void invalidKeyIsAnAuthFailure() {
        enqueueError(400, "keyInvalid");

        FetchException failure = catchThrowableOfType(() -> fetcher.resolve("@creator", CREDENTIAL), FetchException.class);

        assertThat(failure.classification()).isEqualTo(FailureClassification.FATAL_AUTH_ERROR);
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

        FetchException failure = catchThrowableOfType(() -> fetcher.fetchChildren("UU1", null, CREDENTIAL), FetchException.class);

        assertThat(failure.classification()).isEqualTo(FailureClassification.TRANSIENT_ERROR);
        assertThat(failure.httpStatus()).isEqualTo(503);
    }

    @Test
    void missingPlaylistIsNotFound() {
        enqueueError(404, "playlistNotFound");

        FetchException failure = catchThrowableOfType(() -> fetcher.fetchChildren("UU1", null, CREDENTIAL), FetchException.class);

        assertThat(failure.classification()).isEqualTo(FailureClassification.NOT_FOUND);
    }

    @Test
    void unparseableBodyIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody("{not json"));

        FetchException failure = catchThrowableOfType(() -> fetcher.fetchEntity("UC1", CREDENTIAL), FetchException.class);

        assertThat(failure.classification()).isEqualTo(FailureClassification.TRANSIENT_ERROR);
        assertThat(failure.reason()).isEqualTo(ApiErrorClassifier.MALFORMED_RESPONSE);
    }

    @Test
    void stripAtRemovesLeadingMarkers() {
        assertThat(YouTubeDataApiFetcher.stripAt(" @@name ")).isEqualTo("name");
        assertThat(YouTubeDataApiFetcher.stripAt(null)).isEmpty();
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body));
    }

    private void enqueueError(int status, String reason) {
        String body = "{\"error\":{\"code\":" + status + ",\"message\":\"denied\",\"errors\":[{\"reason\":\"" + reason + "\"}]}}";
        server.enqueue(new MockResponse().setResponseCode(status).setHeader("Content-Type", "application/json").setBody(body));
    }
}
