package com.example.mesh.exception;

/**
 * Missing, invalid, expired or revoked session token.
 */
public class UnauthenticatedException extends RuntimeException {
  public UnauthenticatedException(String message) {
    super(message);
  }
}
