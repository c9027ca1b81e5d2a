package com.delta.creatoringest.ingest.api;

import com.delta.creatoringest.ingest.model.IngestRunStartResponse;
import com.delta.creatoringest.ingest.model.IngestRunStatus;
import com.delta.creatoringest.ingest.model.IngestStatusResponse;
import com.delta.creatoringest.ingest.service.IngestRunService;
import com.delta.creatoringest.ingest.service.IngestStatusService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ingest")
public class IngestController {
    private final IngestRunService ingestRunService;
    private final IngestStatusService ingestStatusService;

    public IngestController(IngestRunService ingestRunService, IngestStatusService ingestStatusService) {
        this.ingestRunService = ingestRunService;
        this.ingestStatusService = ingestStatusService;
    }

    @PostMapping("/run")
    public ResponseEntity<IngestRunStartResponse> startRun() {
        long runId = ingestRunService.startAsync();
        return ResponseEntity.accepted()
            .body(new IngestRunStartResponse(runId, IngestRunService.STATUS_RUNNING, "/api/ingest/runs/" + runId));
    }

    @GetMapping("/runs/{runId}")
    public IngestRunStatus getRun(@PathVariable("runId") long runId) {
        return ingestStatusService.getRun(runId);
    }

    @GetMapping("/status")
    public IngestStatusResponse getStatus() {
        return ingestStatusService.getStatus();
    }

    @DeleteMapping("/checkpoint")
    public ResponseEntity<Void> resetCheckpoint() {
        ingestStatusService.resetCheckpoint();
        return ResponseEntity.noContent().build();
    }
}
