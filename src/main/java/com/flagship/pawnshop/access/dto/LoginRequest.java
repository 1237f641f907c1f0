package com.flagship.pawnshop.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class LoginRequest {

    @NotBlank(message = "Username is required")
    @JsonProperty("username")
    String username;

    @NotBlank(message = "Password is required")
    @JsonProperty("password")
    String password;
}
