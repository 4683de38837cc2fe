package com.example.mesh.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String ANY_PATH = "/**";

    // Identity paths
    public static final String REGISTER = "/register";
    public static final String LOGIN = "/login";
    public static final String LOGOUT = "/logout";
    public static final String ME = "/me";

    // Resource paths
    public static final String DATA = "/data";
    public static final String IS_LOGGED_IN = "/is-logged-in";

    // Health paths
    public static final String HEALTH = "/health";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
