package com.statejobs.harvester.crawl.api;

import com.statejobs.harvester.crawl.service.ActiveHarvestRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HarvestExceptionHandler {

  @ExceptionHandler(ActiveHarvestRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveHarvestRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_harvest_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, String>> handleMisconfiguration(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "invalid_configuration", "message", String.valueOf(ex.getMessage())));
  }
}
