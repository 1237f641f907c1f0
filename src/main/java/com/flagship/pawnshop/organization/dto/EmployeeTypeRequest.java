package com.flagship.pawnshop.organization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class EmployeeTypeRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 50)
    @JsonProperty("name")
    String name;

    @Size(max = 255)
    @JsonProperty("description")
    String description;
}
