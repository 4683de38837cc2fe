package com.example.mesh.service.resource;

import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Extracts a bearer token from an {@code Authorization} header value.
 */
@UtilityClass
public class BearerTokens {

  public static final String PREFIX = "Bearer ";

  /**
   * @param authorizationHeader raw header value, may be null
   * @return the token, or empty when the header is absent, uses another scheme or
   *         carries no token
   */
  public static Optional<String> extract(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(PREFIX)) {
      return Optional.empty();
    }
    String token = authorizationHeader.substring(PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
