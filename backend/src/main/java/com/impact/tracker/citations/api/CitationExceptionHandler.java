package com.impact.tracker.citations.api;

import com.impact.tracker.citations.persistence.SnapshotNotFoundException;
import com.impact.tracker.citations.service.ActiveCitationRunException;
import com.impact.tracker.citations.service.TrackerConfigurationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CitationExceptionHandler {

  @ExceptionHandler(ActiveCitationRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCitationRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_citation_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(TrackerConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleConfiguration(TrackerConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_configuration", "message", ex.getMessage()));
  }

  @ExceptionHandler(SnapshotNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleMissingSnapshot(SnapshotNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "snapshot_not_found", "message", ex.getMessage()));
  }
}
