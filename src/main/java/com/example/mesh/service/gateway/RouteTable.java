package com.example.mesh.service.gateway;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable routing table resolving public paths by longest matching prefix.
 */
public class RouteTable {

  private final List<Route> routes;

  public RouteTable(List<Route> routes) {
    this.routes = routes.stream()
        .sorted(Comparator.comparingInt((Route route) -> route.publicPrefix().length()).reversed())
        .toList();
  }

  public Optional<Route> resolve(String path) {
    return routes.stream()
        .filter(route -> route.matches(path))
        .findFirst();
  }

  public List<Route> routes() {
    return routes;
  }
}
