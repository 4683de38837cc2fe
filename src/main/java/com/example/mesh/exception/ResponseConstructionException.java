package com.example.mesh.exception;

/**
 * Raised when a relayed upstream response cannot be turned into a client response.
 */
public class ResponseConstructionException extends RuntimeException {
  public ResponseConstructionException(String message) {
    super(message);
  }

  public ResponseConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
