package com.leadradar.crawl.api;

import com.leadradar.crawl.service.LeadNotFoundException;
import java.util.Map;
import java.util.concurrent.CancellationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(LeadNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(LeadNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "lead_not_found", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(CancellationException.class)
  public ResponseEntity<Map<String, String>> handleCancelled(CancellationException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "crawl_cancelled", "message", String.valueOf(ex.getMessage())));
  }
}
