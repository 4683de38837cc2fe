package com.example.mesh.exception;

/**
 * Raised when the inbound request body cannot be read.
 */
public class MalformedClientRequestException extends RuntimeException {
  public MalformedClientRequestException(String message) {
    super(message);
  }

  public MalformedClientRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
