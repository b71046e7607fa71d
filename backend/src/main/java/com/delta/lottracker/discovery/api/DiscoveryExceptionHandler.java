package com.delta.lottracker.discovery.api;

import com.delta.lottracker.discovery.service.ActiveDiscoveryRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

  @ExceptionHandler(ActiveDiscoveryRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveDiscoveryRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_discovery_run", "message", ex.getMessage()));
  }
}
