package com.example.mesh.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LoginResponse(
    @JsonProperty("access_token") String accessToken
) {

  @Override
  public String toString() {
    return "LoginResponse[access_token=****]";
  }
}
