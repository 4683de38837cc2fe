package com.example.mesh.exception;

import lombok.Getter;

/**
 * No gateway route matches the requested path.
 */
@Getter
public class RouteNotFoundException extends RuntimeException {

  private final String path;

  public RouteNotFoundException(String path) {
    super("No route configured for path: " + path);
    this.path = path;
  }
}
