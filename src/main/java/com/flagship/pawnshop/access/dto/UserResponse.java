package com.flagship.pawnshop.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.access.UserEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * User as returned by the API. Never carries the password hash.
 */
@Value
@Builder
public class UserResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("username")
    String username;

    @JsonProperty("email")
    String email;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("is_superuser")
    boolean superuser;

    @JsonProperty("role_id")
    UUID roleId;

    @JsonProperty("role")
    String role;

    @JsonProperty("permissions")
    Set<Permission> permissions;

    @JsonProperty("created_at")
    Instant createdAt;

    public static UserResponse from(UserEntity user, String roleName, Set<Permission> permissions) {
        return UserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .email(user.getEmail())
            .firstName(user.getFirstName())
            .lastName(user.getLastName())
            .active(user.isActive())
            .superuser(user.isSuperuser())
            .roleId(user.getRoleId())
            .role(roleName)
            .permissions(permissions)
            .createdAt(user.getCreatedAt())
            .build();
    }
}
