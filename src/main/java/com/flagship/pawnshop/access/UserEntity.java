package com.flagship.pawnshop.access;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Back-office user account. Each user has exactly one role, referenced by id.
 *
 * No setters: changes go through {@link #updateProfile}, {@link #changePassword}
 * and {@link #assignRole} so the password hash is never written in clear.
 */
@Entity
@Table(
    name = "users",
    indexes = {
        @Index(name = "idx_users_role_id", columnList = "role_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String username;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_superuser", nullable = false)
    private boolean superuser;

    @Column(name = "role_id", nullable = false)
    private UUID roleId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static UserEntity create(String username, String email, String passwordHash,
                             String firstName, String lastName, boolean superuser, UUID roleId) {
        return new UserEntity(UUID.randomUUID(), username, email, passwordHash,
            firstName, lastName, true, superuser, roleId, null, null);
    }

    void updateProfile(String email, String firstName, String lastName, Boolean active) {
        if (email != null) {
            this.email = email;
        }
        if (firstName != null) {
            this.firstName = firstName;
        }
        if (lastName != null) {
            this.lastName = lastName;
        }
        if (active != null) {
            this.active = active;
        }
    }

    void changePassword(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    void assignRole(UUID roleId) {
        this.roleId = roleId;
    }
}
