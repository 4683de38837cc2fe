package com.example.mesh.web.rest.controller;

import static com.example.mesh.web.rest.ApiConstants.ApiPath.*;

import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.web.rest.dto.LoginStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Login status",
    description = "Reports whether the caller holds a live session"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface LoginStatusAPI {

  @Operation(
      summary = "Check login status",
      description = "Never fails with 401: an absent, invalid or revoked token reports logged out"
  )
  @ApiResponse(responseCode = "200", description = "Login status")
  @GetMapping(value = IS_LOGGED_IN)
  ResponseEntity<LoginStatusResponse> isLoggedIn(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);
}
