package com.example.mesh.service.gateway;

import org.springframework.http.HttpHeaders;

/**
 * Upstream response captured in full for relaying to the client.
 */
public record ForwardedResponse(
    int status,
    HttpHeaders headers,
    byte[] body
) {}
