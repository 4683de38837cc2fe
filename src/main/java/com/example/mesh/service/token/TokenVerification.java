package com.example.mesh.service.token;

/**
 * Outcome of verifying a session token. The failure kinds exist for logging only;
 * callers treat every one of them as unauthenticated.
 */
public record TokenVerification(
    Status status,
    TokenClaims claims,
    String detail
) {

  public enum Status {
    VALID,
    MALFORMED,
    BAD_SIGNATURE,
    EXPIRED
  }

  public static TokenVerification valid(TokenClaims claims) {
    return new TokenVerification(Status.VALID, claims, null);
  }

  public static TokenVerification malformed(String detail) {
    return new TokenVerification(Status.MALFORMED, null, detail);
  }

  public static TokenVerification badSignature(String detail) {
    return new TokenVerification(Status.BAD_SIGNATURE, null, detail);
  }

  public static TokenVerification expired(String detail) {
    return new TokenVerification(Status.EXPIRED, null, detail);
  }

  public boolean isValid() {
    return status == Status.VALID;
  }
}
