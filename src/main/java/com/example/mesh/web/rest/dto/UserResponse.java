package com.example.mesh.web.rest.dto;

import com.example.mesh.domain.entity.User;

/**
 * Public view of a user, without its credential digest.
 */
public record UserResponse(String id, String email) {

  public static UserResponse from(User user) {
    return new UserResponse(user.id(), user.email());
  }
}
