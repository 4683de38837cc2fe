package com.example.mesh.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record DataResponse(
    String message,
    @JsonProperty("user_email") String userEmail,
    List<DataItem> data
) {}
