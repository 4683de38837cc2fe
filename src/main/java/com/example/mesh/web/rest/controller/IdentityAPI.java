package com.example.mesh.web.rest.controller;

import static com.example.mesh.web.rest.ApiConstants.ApiPath.*;

import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.web.rest.dto.LoginRequest;
import com.example.mesh.web.rest.dto.LoginResponse;
import com.example.mesh.web.rest.dto.RegisterRequest;
import com.example.mesh.web.rest.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Identity",
    description = "User registration and session issuance"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface IdentityAPI {

  @Operation(
      summary = "Register a user",
      description = "Creates a user keyed by email. No session is issued."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "User created"),
      @ApiResponse(responseCode = "400", description = "Email or password missing"),
      @ApiResponse(responseCode = "409", description = "Email already registered"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @PostMapping(value = REGISTER, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request);

  @Operation(
      summary = "Log in",
      description = "Verifies credentials and returns a session token whose session record is already live"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session token issued"),
      @ApiResponse(responseCode = "400", description = "Email or password missing"),
      @ApiResponse(responseCode = "401", description = "Invalid credentials"),
      @ApiResponse(responseCode = "500", description = "Session could not be recorded")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request);

  @Operation(
      summary = "Log out",
      description = "Revokes the session record behind the presented token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Session revoked"),
      @ApiResponse(responseCode = "401", description = "Token missing or invalid"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Void> logout(
      @Parameter(description = "Bearer session token", required = true)
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
                             );

  @Operation(
      summary = "Current user",
      description = "Returns the user behind the presented session token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Current user"),
      @ApiResponse(responseCode = "401", description = "No live session"),
      @ApiResponse(responseCode = "404", description = "Session subject is not a known user"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @GetMapping(value = ME)
  ResponseEntity<UserResponse> currentUser(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);
}
