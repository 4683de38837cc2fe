package com.example.mesh.domain.entity;

/**
 * Registered user. Immutable once created; the credential digest never leaves
 * the identity service.
 */
public record User(
    String id,
    String email,
    String credentialDigest
) {
  @Override
  public String toString() {
    return "User[id=" + id + ", email=" + email + "]";
  }
}
