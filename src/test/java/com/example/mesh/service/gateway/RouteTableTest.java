package com.example.mesh.service.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RouteTableTest {

  private final RouteTable table = new RouteTable(List.of(
      new Route("/api/auth", "http://auth:8080", "/api"),
      new Route("/api/data", "http://data:8081/", "/api"),
      new Route("/api/data/v2", "http://data-v2:8081", "/api/v2"),
      new Route("/api/test", "http://status:8082", "/api")));

  @Test
  void resolve_matchesPrefixFollowedBySegment() {
    assertThat(table.resolve("/api/auth/login"))
        .hasValueSatisfying(route -> assertThat(route.baseUrl()).isEqualTo("http://auth:8080"));
  }

  @Test
  void resolve_requiresSlashAfterPrefix() {
    assertThat(table.resolve("/api/authx/login")).isEmpty();
    assertThat(table.resolve("/api/auth")).isEmpty();
  }

  @Test
  void resolve_unknownPrefix_isEmpty() {
    assertThat(table.resolve("/api/unknown/x")).isEmpty();
    assertThat(table.resolve("/other")).isEmpty();
  }

  @Test
  void resolve_prefersLongestPrefix() {
    assertThat(table.resolve("/api/data/v2/items"))
        .hasValueSatisfying(route -> assertThat(route.publicPrefix()).isEqualTo("/api/data/v2"));
    assertThat(table.resolve("/api/data/items"))
        .hasValueSatisfying(route -> assertThat(route.publicPrefix()).isEqualTo("/api/data"));
  }

  @Test
  void rewrite_swapsPublicPrefixForInternalOne() {
    Route route = table.resolve("/api/auth/login").orElseThrow();

    assertThat(route.rewrite("/api/auth/login", null)).isEqualTo("http://auth:8080/api/login");
  }

  @Test
  void rewrite_trailingSlashOnBaseUrl_isNormalised() {
    Route route = table.resolve("/api/data/data").orElseThrow();

    assertThat(route.rewrite("/api/data/data", null)).isEqualTo("http://data:8081/api/data");
  }

  @Test
  void rewrite_keepsRawQuery() {
    Route route = table.resolve("/api/test/is-logged-in").orElseThrow();

    assertThat(route.rewrite("/api/test/is-logged-in", "verbose=1&x=a%20b"))
        .isEqualTo("http://status:8082/api/is-logged-in?verbose=1&x=a%20b");
  }
}
