package com.flagship.pawnshop.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.access.AccessControlTable;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.access.RoleEntity;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Value
public class RoleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("permissions")
    Set<Permission> permissions;

    @JsonProperty("created_at")
    Instant createdAt;

    public static RoleResponse from(RoleEntity role) {
        return new RoleResponse(
            role.getId(),
            role.getName(),
            role.getDescription(),
            AccessControlTable.permissionsFor(role.getName()),
            role.getCreatedAt()
        );
    }
}
