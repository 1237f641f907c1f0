package com.flagship.pawnshop.organization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Create or update an employee. On update, null fields are left unchanged
 * and {@code user_id} is ignored.
 */
@Value
public class EmployeeRequest {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("employee_type_id")
    UUID employeeTypeId;

    @JsonProperty("hire_date")
    LocalDate hireDate;
}
