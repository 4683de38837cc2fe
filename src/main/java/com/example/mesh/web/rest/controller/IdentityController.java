package com.example.mesh.web.rest.controller;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.domain.entity.User;
import com.example.mesh.exception.UnauthenticatedException;
import com.example.mesh.service.identity.IdentityService;
import com.example.mesh.service.resource.BearerTokens;
import com.example.mesh.web.rest.dto.LoginRequest;
import com.example.mesh.web.rest.dto.LoginResponse;
import com.example.mesh.web.rest.dto.RegisterRequest;
import com.example.mesh.web.rest.dto.UserResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Profile({ServiceRole.IDENTITY, ServiceRole.ALL_BACKENDS})
@RequiredArgsConstructor
public class IdentityController implements IdentityAPI {

  private final IdentityService identityService;

  @Override
  public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
    User user = identityService.register(request.email(), request.password());
    return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
  }

  @Override
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    String token = identityService.login(request.email(), request.password());
    return ResponseEntity.ok(new LoginResponse(token));
  }

  @Override
  public ResponseEntity<Void> logout(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    String token = BearerTokens.extract(authorization)
        .orElseThrow(() -> new UnauthenticatedException("Missing bearer token"));
    identityService.logout(token);
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<UserResponse> currentUser(@AuthenticationPrincipal SessionPrincipal principal) {
    return ResponseEntity.ok(UserResponse.from(identityService.currentUser(principal.subjectId())));
  }
}
