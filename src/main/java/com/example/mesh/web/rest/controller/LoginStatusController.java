package com.example.mesh.web.rest.controller;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.web.rest.dto.LoginStatusResponse;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Profile({ServiceRole.STATUS, ServiceRole.ALL_BACKENDS})
public class LoginStatusController implements LoginStatusAPI {

  @Override
  public ResponseEntity<LoginStatusResponse> isLoggedIn(@AuthenticationPrincipal SessionPrincipal principal) {
    if (principal == null) {
      return ResponseEntity.ok(LoginStatusResponse.loggedOut());
    }
    return ResponseEntity.ok(LoginStatusResponse.loggedInAs(principal.identity()));
  }
}
