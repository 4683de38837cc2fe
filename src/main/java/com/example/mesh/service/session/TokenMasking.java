package com.example.mesh.service.session;

import lombok.experimental.UtilityClass;

/**
 * Keeps full session tokens out of log output.
 */
@UtilityClass
public class TokenMasking {

  public static String mask(String token) {
    if (token == null || token.length() < 8) return "INVALID";
    return token.substring(0, 8) + "...";
  }
}
