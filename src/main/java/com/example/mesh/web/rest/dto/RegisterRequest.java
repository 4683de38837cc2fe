package com.example.mesh.web.rest.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record RegisterRequest(
    @Schema(example = "user@example.com") @NotBlank String email,
    @Schema(example = "s3cret") @NotBlank String password
) {

  @Override
  public String toString() {
    return "RegisterRequest[email=" + email + "]";
  }
}
