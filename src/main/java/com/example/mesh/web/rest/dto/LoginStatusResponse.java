package com.example.mesh.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login status answer. {@code user} is always serialized, as {@code null} when logged out.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record LoginStatusResponse(
    @JsonProperty("is_logged_in") boolean loggedIn,
    String user
) {

  public static LoginStatusResponse loggedOut() {
    return new LoginStatusResponse(false, null);
  }

  public static LoginStatusResponse loggedInAs(String identity) {
    return new LoginStatusResponse(true, identity);
  }
}
