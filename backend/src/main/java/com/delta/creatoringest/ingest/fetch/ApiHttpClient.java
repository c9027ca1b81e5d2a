package com.delta.creatoringest.ingest.fetch;

import com.delta.creatoringest.config.IngestProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin GET client for the data API. Every call is a single attempt: transport problems come back
 * as an {@link ApiResponse} with an error code, and retrying is left to the caller's retry policy.
 * <p>
 * The API key travels as the {@code key} query parameter and is never part of {@link ApiResponse#endpoint()}.
 */
@Service
public class ApiHttpClient {
    private final IngestProperties properties;
    private final HttpClient client;

    public ApiHttpClient(IngestProperties properties, HttpClient apiHttpClient) {
        this.properties = properties;
        this.client = apiHttpClient;
    }

    public ApiResponse get(String resource, Map<String, String> params, String apiKey) {
        Instant startedAt = Instant.now();
        String endpoint = properties.getApi().getBaseUrl() + "/" + resource;
        URI uri;
        try {
            uri = URI.create(endpoint + "?" + query(params, apiKey));
        } catch (IllegalArgumentException e) {
            return errorResult(endpoint, startedAt, "invalid_url", e.getMessage());
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new ApiResponse(
                endpoint,
                response.statusCode(),
                response.body(),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(endpoint, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(endpoint, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(endpoint, startedAt, "interrupted", e.getMessage());
        }
    }

    private String query(Map<String, String> params, String apiKey) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
        }
        if (apiKey != null) {
            joiner.add("key=" + encode(apiKey));
        }
        return joiner.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private ApiResponse errorResult(String endpoint, Instant startedAt, String code, String message) {
        return new ApiResponse(
            endpoint,
            0,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
