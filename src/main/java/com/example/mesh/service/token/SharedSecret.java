package com.example.mesh.service.token;

import java.nio.charset.StandardCharsets;

/**
 * Symmetric key shared by every service that signs or verifies session tokens.
 * Passed explicitly to the {@link TokenCodec}; never held in a static.
 */
public final class SharedSecret {

  /** HS256 needs a key at least as long as the hash output. */
  public static final int MIN_LENGTH_BYTES = 32;

  private final byte[] key;

  private SharedSecret(byte[] key) {
    if (key == null || key.length < MIN_LENGTH_BYTES) {
      throw new IllegalArgumentException(
          "Shared secret must be at least " + MIN_LENGTH_BYTES + " bytes");
    }
    this.key = key.clone();
  }

  public static SharedSecret of(String secret) {
    if (secret == null) {
      throw new IllegalArgumentException("Shared secret is not configured");
    }
    return new SharedSecret(secret.getBytes(StandardCharsets.UTF_8));
  }

  byte[] key() {
    return key.clone();
  }

  @Override
  public String toString() {
    return "SharedSecret[****]";
  }
}
