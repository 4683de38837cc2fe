package com.example.mesh.web.rest.controller;

import static com.example.mesh.web.rest.ApiConstants.ApiPath.*;

import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.web.rest.dto.DataResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Data",
    description = "Session-protected data resource"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface DataAPI {

  @Operation(
      summary = "Get data",
      description = "Returns the caller's data. Requires a live session."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Data returned"),
      @ApiResponse(responseCode = "401", description = "No live session"),
      @ApiResponse(responseCode = "500", description = "Session store unavailable")
  })
  @GetMapping(value = DATA)
  ResponseEntity<DataResponse> getData(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);
}
