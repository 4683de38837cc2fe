package com.example.mesh.web.rest.errors;

import com.example.mesh.exception.DuplicateRegistrationException;
import com.example.mesh.exception.InvalidCredentialsException;
import com.example.mesh.exception.MalformedClientRequestException;
import com.example.mesh.exception.ResponseConstructionException;
import com.example.mesh.exception.RouteNotFoundException;
import com.example.mesh.exception.SessionStoreException;
import com.example.mesh.exception.TokenIssuanceException;
import com.example.mesh.exception.UnauthenticatedException;
import com.example.mesh.exception.UpstreamUnavailableException;
import com.example.mesh.exception.UserNotFoundException;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information.
 * Authentication failures are answered uniformly; the cause is only logged.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

  private static final String INTERNAL_ERROR_MESSAGE = "An error occurred processing your request";

  @ExceptionHandler(DuplicateRegistrationException.class)
  public ResponseEntity<Map<String, Object>> handleDuplicateRegistration(
      DuplicateRegistrationException ex, WebRequest request) {
    return respond(HttpStatus.CONFLICT, "registration_conflict", ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidCredentials(
      InvalidCredentialsException ex, WebRequest request) {
    return respond(HttpStatus.UNAUTHORIZED, "invalid_credentials", InvalidCredentialsException.MESSAGE,
        request);
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<Map<String, Object>> handleUnauthenticated(
      UnauthenticatedException ex, WebRequest request) {
    return respond(HttpStatus.UNAUTHORIZED, ErrorBodies.UNAUTHENTICATED_ERROR,
        ErrorBodies.UNAUTHENTICATED_MESSAGE, request);
  }

  @ExceptionHandler(MalformedClientRequestException.class)
  public ResponseEntity<Map<String, Object>> handleMalformedRequest(
      MalformedClientRequestException ex, WebRequest request) {
    log.warn("Malformed client request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .sorted()
        .collect(Collectors.joining(", "));

    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableMessage(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request body is missing or malformed",
        request);
  }

  @ExceptionHandler(RouteNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleRouteNotFound(
      RouteNotFoundException ex, WebRequest request) {
    return respond(HttpStatus.NOT_FOUND, "not_found", "No route for " + ex.getPath(), request);
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleUserNotFound(
      UserNotFoundException ex, WebRequest request) {
    return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNoResource(
      NoResourceFoundException ex, WebRequest request) {
    return respond(HttpStatus.NOT_FOUND, "not_found", "Resource not found", request);
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleUpstreamUnavailable(
      UpstreamUnavailableException ex, WebRequest request) {
    return respond(HttpStatus.BAD_GATEWAY, "bad_gateway", ex.getMessage(), request);
  }

  @ExceptionHandler({SessionStoreException.class, TokenIssuanceException.class})
  public ResponseEntity<Map<String, Object>> handleSessionFault(
      RuntimeException ex, WebRequest request) {
    log.error("Session fault", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", INTERNAL_ERROR_MESSAGE, request);
  }

  @ExceptionHandler(ResponseConstructionException.class)
  public ResponseEntity<Map<String, Object>> handleResponseConstruction(
      ResponseConstructionException ex, WebRequest request) {
    log.error("Failed to construct response", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", INTERNAL_ERROR_MESSAGE, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()), request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported_media_type",
        String.format("Content type %s not supported", ex.getContentType()), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", INTERNAL_ERROR_MESSAGE, request);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, WebRequest request) {
    return new ResponseEntity<>(ErrorBodies.create(status, error, message, extractPath(request)), status);
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
