package com.flagship.pawnshop.organization;

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
import java.time.LocalDate;
import java.util.UUID;

/**
 * Links a user account to a branch and an employee type.
 */
@Entity
@Table(
    name = "employees",
    indexes = {
        @Index(name = "idx_employees_type", columnList = "employee_type_id"),
        @Index(name = "idx_employees_branch", columnList = "branch_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmployeeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Column(name = "branch_id", nullable = false)
    private UUID branchId;

    @Column(name = "employee_type_id", nullable = false)
    private UUID employeeTypeId;

    @Column(name = "hire_date")
    private LocalDate hireDate;

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

    static EmployeeEntity create(UUID userId, UUID branchId, UUID employeeTypeId, LocalDate hireDate) {
        return new EmployeeEntity(UUID.randomUUID(), userId, branchId, employeeTypeId, hireDate, null, null);
    }

    void update(UUID branchId, UUID employeeTypeId, LocalDate hireDate) {
        if (branchId != null) {
            this.branchId = branchId;
        }
        if (employeeTypeId != null) {
            this.employeeTypeId = employeeTypeId;
        }
        if (hireDate != null) {
            this.hireDate = hireDate;
        }
    }
}
