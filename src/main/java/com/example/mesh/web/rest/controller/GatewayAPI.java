package com.example.mesh.web.rest.controller;

import static com.example.mesh.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Gateway",
    description = "Public entry point forwarding to internal services by path prefix"
)
public interface GatewayAPI {

  @Operation(
      summary = "Forward a request",
      description = "Relays any method on /api/<service>/<rest> to the mapped internal service "
          + "and returns its status, headers and body unchanged"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "2XX", description = "Relayed from the internal service"),
      @ApiResponse(responseCode = "400", description = "Request body could not be read"),
      @ApiResponse(responseCode = "404", description = "No route for the path"),
      @ApiResponse(responseCode = "502", description = "Internal service unreachable or timed out"),
      @ApiResponse(responseCode = "500", description = "Response could not be relayed")
  })
  @RequestMapping(value = API_BASE + ANY_PATH)
  void forward(HttpServletRequest request, HttpServletResponse response);
}
