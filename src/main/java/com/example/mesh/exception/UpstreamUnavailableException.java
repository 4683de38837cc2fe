package com.example.mesh.exception;

/**
 * Raised when a forwarding target cannot be reached or its response cannot be read.
 */
public class UpstreamUnavailableException extends RuntimeException {
  public UpstreamUnavailableException(String message) {
    super(message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
