package com.flagship.pawnshop.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RoleRequest {

    @NotBlank(message = "Role name is required")
    @Size(max = 50)
    @JsonProperty("name")
    String name;

    @Size(max = 255)
    @JsonProperty("description")
    String description;
}
