package com.delta.creatoringest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT = "creator-ingest/0.1 (+contact)";
    private static final int API_MAX_IDS_PER_CALL = 50;

    private String userAgent;
    private int maxConcurrency = 3;
    private int callDelayMs = 200;
    private int taskDelayMs = 1500;
    private int requestTimeoutSeconds = 20;
    private Api api = new Api();
    private Credentials credentials = new Credentials();
    private Input input = new Input();
    private Checkpoint checkpoint = new Checkpoint();
    private Retry retry = new Retry();
    private Fetch fetch = new Fetch();
    private Persistence persistence = new Persistence();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public int getCallDelayMs() {
        return Math.max(0, callDelayMs);
    }

    public void setCallDelayMs(int callDelayMs) {
        this.callDelayMs = Math.max(0, callDelayMs);
    }

    public int getTaskDelayMs() {
        return Math.max(0, taskDelayMs);
    }

    public void setTaskDelayMs(int taskDelayMs) {
        this.taskDelayMs = Math.max(0, taskDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Input getInput() {
        return input;
    }

    public void setInput(Input input) {
        this.input = input;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String baseUrl = "https://www.googleapis.com/youtube/v3";

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "https://www.googleapis.com/youtube/v3";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Credentials {
        private List<String> apiKeys = new ArrayList<>();

        /**
         * Configured keys in order, with blanks and repeated keys removed.
         */
        public List<String> getApiKeys() {
            List<String> out = new ArrayList<>();
            if (apiKeys == null) {
                return out;
            }
            for (String key : apiKeys) {
                if (key == null || key.isBlank()) {
                    continue;
                }
                String trimmed = key.trim();
                if (!out.contains(trimmed)) {
                    out.add(trimmed);
                }
            }
            return out;
        }

        public void setApiKeys(List<String> apiKeys) {
            this.apiKeys = apiKeys == null ? new ArrayList<>() : new ArrayList<>(apiKeys);
        }
    }

    public static class Input {
        private String csvPath = "data/channel_handles.csv";
        private String handleColumn = "channel_user";

        public String getCsvPath() {
            return csvPath;
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }

        public String getHandleColumn() {
            return handleColumn;
        }

        public void setHandleColumn(String handleColumn) {
            this.handleColumn = handleColumn;
        }
    }

    public static class Checkpoint {
        private String path = "data/ingest_checkpoint.json";
        private int flushEvery = 3;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getFlushEvery() {
            return Math.max(1, flushEvery);
        }

        public void setFlushEvery(int flushEvery) {
            this.flushEvery = Math.max(1, flushEvery);
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 60000;
        private boolean skipOnExhaustion = true;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public boolean isSkipOnExhaustion() {
            return skipOnExhaustion;
        }

        public void setSkipOnExhaustion(boolean skipOnExhaustion) {
            this.skipOnExhaustion = skipOnExhaustion;
        }
    }

    public static class Fetch {
        private int pageSize = 50;
        private int maxPages = 400;
        private int statsBatchSize = 50;
        private int descriptionMaxLength = 1000;
        private boolean searchFallback = true;

        public int getPageSize() {
            return Math.max(1, Math.min(API_MAX_IDS_PER_CALL, pageSize));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getStatsBatchSize() {
            return Math.max(1, Math.min(API_MAX_IDS_PER_CALL, statsBatchSize));
        }

        public void setStatsBatchSize(int statsBatchSize) {
            this.statsBatchSize = statsBatchSize;
        }

        public int getDescriptionMaxLength() {
            return Math.max(0, descriptionMaxLength);
        }

        public void setDescriptionMaxLength(int descriptionMaxLength) {
            this.descriptionMaxLength = descriptionMaxLength;
        }

        public boolean isSearchFallback() {
            return searchFallback;
        }

        public void setSearchFallback(boolean searchFallback) {
            this.searchFallback = searchFallback;
        }
    }

    public static class Persistence {
        private int batchSize = 100;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
