package com.example.mesh.exception;

/**
 * Registration attempted for an email that already belongs to a user.
 */
public class DuplicateRegistrationException extends RuntimeException {
  public DuplicateRegistrationException(String message) {
    super(message);
  }
}
