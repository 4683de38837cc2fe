package com.example.mesh.web.rest.controller;

import static com.example.mesh.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Health",
    description = "Liveness check for load balancers"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.TEXT_PLAIN_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Basic health check",
      description = "Answers with the service name; does not touch the session store"
  )
  @ApiResponse(responseCode = "200", description = "Service is up")
  @GetMapping(value = HEALTH)
  ResponseEntity<String> health();
}
