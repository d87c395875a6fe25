package com.flamingo.ai.houseanalysis.api.rest;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the service banner and health checks. */
@RestController
public class HealthController {

  /** Returns the service banner. */
  @GetMapping("/")
  public ResponseEntity<Map<String, String>> root() {
    return ResponseEntity.ok(Map.of("message", "House Analysis API"));
  }

  /** Returns a simple health check response. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "house-analysis");
    return ResponseEntity.ok(health);
  }
}
