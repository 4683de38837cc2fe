package com.example.mesh.domain.entity;

/**
 * Session Principal - the verified caller behind a live session token
 */
public record SessionPrincipal(
    String subjectId,
    String identity
) {}
