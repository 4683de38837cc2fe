package com.example.mesh.config;

/**
 * Spring profile names selecting which service this process runs as.
 */
public final class ServiceRole {

  public static final String IDENTITY = "identity";
  public static final String DATA = "data";
  public static final String STATUS = "status";
  public static final String GATEWAY = "gateway";

  /**
   * Every backend role in one process. Set as {@code spring.profiles.default}, so it is
   * active when no profile is given; it must be named when combined with other profiles.
   */
  public static final String ALL_BACKENDS = "all";

  /** Roles that sign or verify session tokens. */
  public static final String BACKEND = "!" + GATEWAY;

  private ServiceRole() {}
}
