package com.flagship.pawnshop.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
@Value
public class UpdateUserRequest {

    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;

    @Size(min = 8, message = "Password must be at least 8 characters")
    @JsonProperty("password")
    String password;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("is_active")
    Boolean active;

    @JsonProperty("role_id")
    UUID roleId;
}
