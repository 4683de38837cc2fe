package com.example.mesh.service.gateway;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.http.HttpHeaders;

/**
 * Lower-cased names of the headers the client actually sent. Attached to the upstream
 * request as an OkHttp tag for {@link ClientHeaderInterceptor}.
 */
public record ClientHeaderNames(Set<String> names) {

  public static ClientHeaderNames of(HttpHeaders headers) {
    return new ClientHeaderNames(headers.keySet().stream()
        .map(name -> name.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet()));
  }

  public boolean contains(String name) {
    return names.contains(name.toLowerCase(Locale.ROOT));
  }
}
