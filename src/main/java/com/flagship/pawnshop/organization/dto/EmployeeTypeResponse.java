package com.flagship.pawnshop.organization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.organization.EmployeeTypeEntity;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EmployeeTypeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EmployeeTypeResponse from(EmployeeTypeEntity type) {
        return new EmployeeTypeResponse(type.getId(), type.getName(), type.getDescription(), type.getCreatedAt());
    }
}
