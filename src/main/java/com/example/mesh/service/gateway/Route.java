package com.example.mesh.service.gateway;

/**
 * Maps a public path prefix onto an internal service.
 *
 * @param publicPrefix   prefix clients call, e.g. {@code /api/auth}
 * @param baseUrl        internal service address, e.g. {@code http://auth-service:8080}
 * @param internalPrefix prefix re-attached on the internal side, e.g. {@code /api}
 */
public record Route(
    String publicPrefix,
    String baseUrl,
    String internalPrefix
) {

  public Route {
    baseUrl = stripTrailingSlash(baseUrl);
    internalPrefix = internalPrefix == null ? "" : stripTrailingSlash(internalPrefix);
  }

  /**
   * A path matches when it continues with a segment after the prefix:
   * {@code /api/auth/login} matches {@code /api/auth}, {@code /api/authx} does not.
   */
  public boolean matches(String path) {
    return path.startsWith(publicPrefix + "/");
  }

  /**
   * @param path     public path, already known to match
   * @param rawQuery query string without {@code ?}, may be null
   * @return absolute internal URL
   */
  public String rewrite(String path, String rawQuery) {
    String target = baseUrl + internalPrefix + path.substring(publicPrefix.length());
    return rawQuery == null || rawQuery.isEmpty() ? target : target + "?" + rawQuery;
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
