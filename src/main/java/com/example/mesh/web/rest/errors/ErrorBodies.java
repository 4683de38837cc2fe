package com.example.mesh.web.rest.errors;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.experimental.UtilityClass;
import org.springframework.http.HttpStatus;

/**
 * The JSON error body shared by the error handler and the authentication entry point.
 */
@UtilityClass
public class ErrorBodies {

  public static final String UNAUTHENTICATED_ERROR = "not_authenticated";
  public static final String UNAUTHENTICATED_MESSAGE = "Authentication required";

  public static Map<String, Object> create(HttpStatus status, String error, String message, String path) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", path);
    return body;
  }
}
