package com.flagship.pawnshop.organization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.organization.EmployeeEntity;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class EmployeeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("employee_type_id")
    UUID employeeTypeId;

    @JsonProperty("hire_date")
    LocalDate hireDate;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EmployeeResponse from(EmployeeEntity employee) {
        return new EmployeeResponse(employee.getId(), employee.getUserId(), employee.getBranchId(),
            employee.getEmployeeTypeId(), employee.getHireDate(), employee.getCreatedAt());
    }
}
