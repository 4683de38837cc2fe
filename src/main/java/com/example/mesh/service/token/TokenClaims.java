package com.example.mesh.service.token;

import java.time.Instant;

/**
 * Claims carried by a session token.
 */
public record TokenClaims(
    String subjectId,
    String identity,
    Instant issuedAt,
    Instant expiresAt
) {}
