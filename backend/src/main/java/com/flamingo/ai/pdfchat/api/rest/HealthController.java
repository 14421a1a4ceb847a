package com.flamingo.ai.pdfchat.api.rest;

import com.flamingo.ai.pdfchat.service.session.SessionRegistry;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for liveness and build information. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final SessionRegistry sessionRegistry;

  @Value("${app.version:0.0.0}")
  private String version;

  @Value("${app.environment:development}")
  private String environment;

  /** Returns a simple health check response. */
  @GetMapping("/healthz")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "ok");
    health.put("version", version);
    health.put("activeSessions", sessionRegistry.size());
    health.put("timestamp", Instant.now());
    return ResponseEntity.ok(health);
  }

  /** Returns the running version. */
  @GetMapping("/version")
  public ResponseEntity<Map<String, Object>> version() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("version", version);
    info.put("environment", environment);
    return ResponseEntity.ok(info);
  }
}
