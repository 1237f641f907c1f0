package com.flagship.pawnshop.organization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class BranchRequest {

    @NotBlank(message = "Branch name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("address")
    String address;

    @JsonProperty("phone")
    String phone;

    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;
}
