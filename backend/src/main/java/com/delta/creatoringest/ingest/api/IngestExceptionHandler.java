package com.delta.creatoringest.ingest.api;

import com.delta.creatoringest.ingest.checkpoint.CheckpointException;
import com.delta.creatoringest.ingest.service.ActiveIngestRunException;
import com.delta.creatoringest.ingest.source.InputSourceException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IngestExceptionHandler {

  @ExceptionHandler(ActiveIngestRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveIngestRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_ingest_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(InputSourceException.class)
  public ResponseEntity<Map<String, String>> handleInputSource(InputSourceException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "input_source_unreadable", "message", ex.getMessage()));
  }

  @ExceptionHandler(CheckpointException.class)
  public ResponseEntity<Map<String, String>> handleCheckpoint(CheckpointException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "checkpoint_io", "message", ex.getMessage()));
  }
}
