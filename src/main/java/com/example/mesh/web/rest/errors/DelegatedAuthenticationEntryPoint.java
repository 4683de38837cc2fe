package com.example.mesh.web.rest.errors;

import com.example.mesh.security.filter.BearerTokenAuthenticationFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Handles what happens when someone calls a protected resource without a live session.
 * <p>
 * Every authentication failure gets the same 401 JSON body, whatever the reason: no
 * header, wrong scheme, bad signature, expired token or revoked session. The reason is
 * only logged. When the session store could not be reached the request is answered
 * with 500 instead, since the session may well be live.
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ObjectMapper objectMapper;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    Map<String, Object> body;
    HttpStatus status;
    if (request.getAttribute(BearerTokenAuthenticationFilter.SESSION_STORE_FAILURE_ATTRIBUTE) != null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
      body = ErrorBodies.create(status, "internal_error",
          "An error occurred processing your request", request.getRequestURI());
    } else {
      status = HttpStatus.UNAUTHORIZED;
      body = ErrorBodies.create(status, ErrorBodies.UNAUTHENTICATED_ERROR,
          ErrorBodies.UNAUTHENTICATED_MESSAGE, request.getRequestURI());
    }

    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
