package com.flamingo.ai.docqa.api.rest;

import com.flamingo.ai.docqa.service.state.DocumentStateManager;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the liveness check. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final DocumentStateManager stateManager;

  /** Returns a simple health check response. */
  @GetMapping("/")
  public ResponseEntity<Map<String, Object>> root() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("message", "Backend is running!");
    health.put("status", "healthy");
    health.put("documentState", stateManager.state());
    return ResponseEntity.ok(health);
  }
}
