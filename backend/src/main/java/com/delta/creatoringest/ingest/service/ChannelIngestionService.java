package com.delta.creatoringest.ingest.service;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.fetch.ChannelFetcher;
import com.delta.creatoringest.ingest.fetch.FetchException;
import com.delta.creatoringest.ingest.model.ApiCredential;
import com.delta.creatoringest.ingest.model.ChildPage;
import com.delta.creatoringest.ingest.model.EntitySnapshot;
import com.delta.creatoringest.ingest.model.IngestTask;
import com.delta.creatoringest.ingest.model.ItemRecord;
import com.delta.creatoringest.ingest.model.ItemStats;
import com.delta.creatoringest.ingest.model.ListingItem;
import com.delta.creatoringest.ingest.model.TaskOutcome;
import com.delta.creatoringest.ingest.model.TaskResult;
import com.delta.creatoringest.ingest.persistence.RecordSink;
import com.delta.creatoringest.ingest.retry.FailureClassification;
import com.delta.creatoringest.ingest.retry.RetryDecision;
import com.delta.creatoringest.ingest.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one handle through resolve, duplicate guard, channel fetch, paginated listing, batched
 * statistics and merge, and decides what happens when any of those calls fails.
 * <p>
 * Nothing is persisted here; the merged records travel back inside the {@link TaskResult}.
 */
@Service
public class ChannelIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ChannelIngestionService.class);

    enum Stage {
        RESOLVE,
        DUPLICATE_GUARD,
        ENTITY,
        CHILDREN,
        STATS
    }

    private final ChannelFetcher fetcher;
    private final RecordSink recordSink;
    private final IngestProperties properties;

    public ChannelIngestionService(ChannelFetcher fetcher, RecordSink recordSink, IngestProperties properties) {
        this.fetcher = fetcher;
        this.recordSink = recordSink;
        this.properties = properties;
    }

    public TaskResult process(IngestTask task, IngestRunContext context) {
        String handle = task.normalizedHandle();
        if (handle.isEmpty()) {
            log.info("Task {} has a blank handle; skipping", task.sequenceIndex());
            return TaskResult.of(task, TaskOutcome.SKIPPED_NO_ENTITY, 0, "blank_handle");
        }
        RetryPolicy retryPolicy = context.retryPolicy();
        int attempts = 0;
        int budgetedFailures = 0;
        while (true) {
            Optional<ApiCredential> credential = context.credentialPool().acquire();
            if (credential.isEmpty()) {
                log.warn("Task {} ({}) halted: every credential is exhausted", task.sequenceIndex(), handle);
                return TaskResult.of(task, TaskOutcome.HALTED_NO_CREDENTIAL, attempts, "no_credentials");
            }
            attempts++;
            StageTracker tracker = new StageTracker();
            try {
                return runStages(task, handle, credential.get(), attempts, tracker);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TaskResult.of(task, TaskOutcome.HALTED_INTERRUPTED, attempts, "interrupted");
            } catch (RuntimeException e) {
                FailureClassification classification = retryPolicy.classify(e);
                if (classification == FailureClassification.TRANSIENT_ERROR
                    || classification == FailureClassification.PERSISTENCE_ERROR) {
                    budgetedFailures++;
                }
                log.warn(
                    "Task {} ({}) failed at {} with credential {}: {} ({})",
                    task.sequenceIndex(),
                    handle,
                    tracker.stage,
                    credential.get().id(),
                    classification,
                    e.getMessage()
                );
                RetryDecision decision = retryPolicy.onFailure(e, credential.get(), budgetedFailures);
                switch (decision.action()) {
                    case SKIP_NO_DATA:
                        TaskOutcome skipped = tracker.stage == Stage.CHILDREN
                            ? TaskOutcome.SKIPPED_NO_CHILDREN
                            : TaskOutcome.SKIPPED_NO_ENTITY;
                        return TaskResult.of(task, skipped, attempts, "not_found_at_" + tracker.stage.name().toLowerCase(Locale.ROOT));
                    case ROTATE_CREDENTIAL:
                        continue;
                    case RETRY_AFTER_BACKOFF:
                        if (!pause(decision.delayMs())) {
                            return TaskResult.of(task, TaskOutcome.HALTED_INTERRUPTED, attempts, "interrupted");
                        }
                        continue;
                    case GIVE_UP:
                    default:
                        if (retryPolicy.isSkipOnExhaustion()) {
                            log.warn("Task {} ({}) skipped after {} attempts", task.sequenceIndex(), handle, attempts);
                            return TaskResult.of(task, TaskOutcome.FAILED_SKIPPED, attempts, classification.name());
                        }
                        return TaskResult.of(task, TaskOutcome.HALTED_RETRIES_EXHAUSTED, attempts, classification.name());
                }
            }
        }
    }

    private TaskResult runStages(
        IngestTask task,
        String handle,
        ApiCredential credential,
        int attempts,
        StageTracker tracker
    ) throws InterruptedException {
        tracker.stage = Stage.RESOLVE;
        Optional<String> entityId = fetcher.resolve(handle, credential);
        if (entityId.isEmpty()) {
            log.info("Task {} ({}): channel not found", task.sequenceIndex(), handle);
            return TaskResult.of(task, TaskOutcome.SKIPPED_NO_ENTITY, attempts, "handle_not_resolved");
        }

        tracker.stage = Stage.DUPLICATE_GUARD;
        if (recordSink.hasCommittedRecords(entityId.get())) {
            log.info("Task {} ({}): channel {} already stored", task.sequenceIndex(), handle, entityId.get());
            return TaskResult.of(task, TaskOutcome.SKIPPED_ALREADY_PROCESSED, attempts, entityId.get());
        }

        pace();
        tracker.stage = Stage.ENTITY;
        Optional<EntitySnapshot> entity = fetcher.fetchEntity(entityId.get(), credential);
        if (entity.isEmpty()) {
            return TaskResult.of(task, TaskOutcome.SKIPPED_NO_ENTITY, attempts, "channel_not_found");
        }
        if (!entity.get().hasListing()) {
            return TaskResult.of(task, TaskOutcome.SKIPPED_NO_CHILDREN, attempts, "no_uploads_listing");
        }

        pace();
        tracker.stage = Stage.CHILDREN;
        List<ListingItem> items = fetchAllChildren(task, entity.get().listingId(), credential);
        if (items.isEmpty()) {
            return TaskResult.of(task, TaskOutcome.SKIPPED_NO_CHILDREN, attempts, "empty_listing");
        }

        tracker.stage = Stage.STATS;
        Map<String, ItemStats> stats = fetchAllStats(task, items, credential);

        List<ItemRecord> records = merge(entity.get(), items, stats);
        log.info(
            "Task {} ({}): {} items, {} with statistics",
            task.sequenceIndex(),
            handle,
            records.size(),
            stats.size()
        );
        return new TaskResult(task, TaskOutcome.PERSISTED, records, attempts, "items=" + records.size());
    }

    List<ListingItem> fetchAllChildren(IngestTask task, String listingId, ApiCredential credential) throws InterruptedException {
        int maxPages = properties.getFetch().getMaxPages();
        Map<String, ListingItem> items = new LinkedHashMap<>();
        Set<String> seenTokens = new HashSet<>();
        String pageToken = null;
        int pages = 0;
        while (true) {
            ChildPage page;
            try {
                page = fetcher.fetchChildren(listingId, pageToken, credential);
            } catch (FetchException e) {
                if (pages == 0 || e.classification() != FailureClassification.NOT_FOUND) {
                    throw e;
                }
                log.warn(
                    "Task {}: listing {} page {} not found ({}); keeping {} items from earlier pages",
                    task.sequenceIndex(),
                    listingId,
                    pages + 1,
                    e.reason(),
                    items.size()
                );
                break;
            }
            pages++;
            for (ListingItem item : page.items()) {
                items.putIfAbsent(item.itemId(), item);
            }
            if (!page.hasNext()) {
                break;
            }
            if (pages >= maxPages) {
                log.warn("Task {}: listing {} still paging after {} pages; stopping", task.sequenceIndex(), listingId, pages);
                break;
            }
            if (!seenTokens.add(page.nextPageToken())) {
                log.warn("Task {}: listing {} repeated page token; stopping", task.sequenceIndex(), listingId);
                break;
            }
            pageToken = page.nextPageToken();
            pace();
        }
        return new ArrayList<>(items.values());
    }

    /**
     * Statistics for every item, in batches. A batch the API reports as not found contributes
     * nothing, so those items are merged with {@link ItemStats#EMPTY}.
     */
    private Map<String, ItemStats> fetchAllStats(IngestTask task, List<ListingItem> items, ApiCredential credential)
        throws InterruptedException {
        int batchSize = properties.getFetch().getStatsBatchSize();
        Map<String, ItemStats> out = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            int end = Math.min(items.size(), i + batchSize);
            List<String> ids = new ArrayList<>(end - i);
            for (ListingItem item : items.subList(i, end)) {
                ids.add(item.itemId());
            }
            pace();
            try {
                out.putAll(fetcher.fetchStats(ids, credential));
            } catch (FetchException e) {
                if (e.classification() != FailureClassification.NOT_FOUND) {
                    throw e;
                }
                log.warn(
                    "Task {}: statistics for {} items not found ({}); storing them without stats",
                    task.sequenceIndex(),
                    ids.size(),
                    e.reason()
                );
            }
        }
        return out;
    }

    static List<ItemRecord> merge(EntitySnapshot entity, List<ListingItem> items, Map<String, ItemStats> stats) {
        List<ItemRecord> records = new ArrayList<>(items.size());
        for (ListingItem item : items) {
            records.add(new ItemRecord(entity, item, stats.getOrDefault(item.itemId(), ItemStats.EMPTY)));
        }
        return records;
    }

    private void pace() throws InterruptedException {
        int delayMs = properties.getCallDelayMs();
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class StageTracker {
        private Stage stage = Stage.RESOLVE;
    }
}
