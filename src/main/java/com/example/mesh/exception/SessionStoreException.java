package com.example.mesh.exception;

/**
 * Session Store Exception. Raised when the shared session store cannot be read or written.
 */
public class SessionStoreException extends RuntimeException {
  public SessionStoreException(String message) {
    super(message);
  }

  public SessionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
