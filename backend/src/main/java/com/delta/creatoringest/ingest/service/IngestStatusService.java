package com.delta.creatoringest.ingest.service;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.checkpoint.CheckpointStore;
import com.delta.creatoringest.ingest.model.IngestRunStatus;
import com.delta.creatoringest.ingest.model.IngestStatusResponse;
import com.delta.creatoringest.ingest.persistence.IngestRunRepository;
import com.delta.creatoringest.ingest.persistence.ItemRecordJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class IngestStatusService {
    private static final Logger log = LoggerFactory.getLogger(IngestStatusService.class);

    private final IngestRunRepository runRepository;
    private final ItemRecordJdbcRepository itemRepository;
    private final CheckpointStore checkpointStore;
    private final IngestRunService runService;
    private final IngestProperties properties;

    public IngestStatusService(
        IngestRunRepository runRepository,
        ItemRecordJdbcRepository itemRepository,
        CheckpointStore checkpointStore,
        IngestRunService runService,
        IngestProperties properties
    ) {
        this.runRepository = runRepository;
        this.itemRepository = itemRepository;
        this.checkpointStore = checkpointStore;
        this.runService = runService;
        this.properties = properties;
    }

    public IngestStatusResponse getStatus() {
        int configured = properties.getCredentials().getApiKeys().size();
        int available = runService.currentRun()
            .map(run -> run.credentialPool().availableCount())
            .orElse(configured);
        boolean dbConnected;
        try {
            dbConnected = runRepository.isDbReachable();
        } catch (Exception e) {
            log.debug("Database not reachable for status", e);
            dbConnected = false;
        }
        long recordCount = 0;
        IngestRunStatus latestRun = null;
        if (dbConnected) {
            recordCount = itemRepository.countRecords();
            latestRun = runRepository.findLatestRun().orElse(null);
        }
        return new IngestStatusResponse(
            dbConnected,
            runService.isRunActive(),
            checkpointStore.load().orElse(null),
            configured,
            available,
            recordCount,
            latestRun
        );
    }

    public IngestRunStatus getRun(long runId) {
        return runRepository.findRun(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown ingest run " + runId));
    }

    public void resetCheckpoint() {
        runService.resetCheckpoint();
    }
}
