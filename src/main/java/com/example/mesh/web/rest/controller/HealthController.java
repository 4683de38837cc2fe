package com.example.mesh.web.rest.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check served by every role. Dependency health is reported by the actuator.
 */
@RestController
public class HealthController implements HealthAPI {

  private final String serviceName;

  public HealthController(@Value("${spring.application.name}") String serviceName) {
    this.serviceName = serviceName;
  }

  @Override
  public ResponseEntity<String> health() {
    return ResponseEntity.ok("OK from " + serviceName);
  }
}
