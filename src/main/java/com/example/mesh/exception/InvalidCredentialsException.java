package com.example.mesh.exception;

/**
 * Login rejected. Thrown with the same message whether the user is unknown or
 * the password is wrong.
 */
public class InvalidCredentialsException extends RuntimeException {

  public static final String MESSAGE = "Invalid credentials";

  public InvalidCredentialsException() {
    super(MESSAGE);
  }
}
