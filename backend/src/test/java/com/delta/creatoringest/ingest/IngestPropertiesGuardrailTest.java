package com.delta.creatoringest.ingest;

import com.delta.creatoringest.config.IngestProperties;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        IngestProperties properties = new IngestProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("creator-ingest/0.1"));
    }

    @Test
    void concurrencyAndDelaysAreClamped() {
        IngestProperties properties = new IngestProperties();
        properties.setMaxConcurrency(0);
        properties.setCallDelayMs(-5);
        properties.setTaskDelayMs(-1);
        properties.setRequestTimeoutSeconds(0);
        assertEquals(1, properties.getMaxConcurrency());
        assertEquals(0, properties.getCallDelayMs());
        assertEquals(0, properties.getTaskDelayMs());
        assertEquals(1, properties.getRequestTimeoutSeconds());
    }

    @Test
    void pageAndBatchSizesStayWithinApiLimits() {
        IngestProperties properties = new IngestProperties();
        properties.getFetch().setPageSize(500);
        properties.getFetch().setStatsBatchSize(0);
        properties.getCheckpoint().setFlushEvery(0);
        properties.getRetry().setMaxRetries(-3);
        assertEquals(50, properties.getFetch().getPageSize());
        assertEquals(1, properties.getFetch().getStatsBatchSize());
        assertEquals(1, properties.getCheckpoint().getFlushEvery());
        assertEquals(0, properties.getRetry().getMaxRetries());
    }

    @Test
    void apiKeysAreTrimmedAndDeduplicated() {
        IngestProperties properties = new IngestProperties();
        properties.getCredentials().setApiKeys(Arrays.asList(" k1 ", "", null, "k2", "k1"));
        assertEquals(Arrays.asList("k1", "k2"), properties.getCredentials().getApiKeys());
    }

    @Test
    void baseUrlDropsTrailingSlash() {
        IngestProperties properties = new IngestProperties();
        properties.getApi().setBaseUrl("http://localhost:8089/youtube/v3/");
        assertEquals("http://localhost:8089/youtube/v3", properties.getApi().getBaseUrl());
    }
}
