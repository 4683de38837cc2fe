package com.example.mesh.exception;

/**
 * A live session names a subject the user directory does not know.
 */
public class UserNotFoundException extends RuntimeException {
  public UserNotFoundException(String message) {
    super(message);
  }
}
