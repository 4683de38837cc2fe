package com.example.mesh.service.gateway;

import org.springframework.http.HttpHeaders;

/**
 * Inbound client request, fully read, as handed to the {@link ProxyService}.
 *
 * @param method   HTTP method
 * @param path     raw request path
 * @param rawQuery raw query string without {@code ?}, may be null
 * @param headers  every request header with all of its values
 * @param body     full request body, empty when none was sent
 */
public record ForwardedRequest(
    String method,
    String path,
    String rawQuery,
    HttpHeaders headers,
    byte[] body
) {}
