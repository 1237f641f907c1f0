package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.application.ApplicationStatus;
import com.flagship.pawnshop.inventory.ItemCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Partial update of an application. Null fields are left unchanged.
 * Moving to REJECTED requires a rejection reason.
 */
@Value
public class ApplicationUpdateRequest {

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("item_category")
    ItemCategory itemCategory;

    @JsonProperty("item_description")
    String itemDescription;

    @DecimalMin(value = "0.01", message = "Estimated value must be greater than 0")
    @JsonProperty("estimated_value")
    BigDecimal estimatedValue;

    @DecimalMin(value = "0.01", message = "Loan amount must be greater than 0")
    @JsonProperty("loan_amount")
    BigDecimal loanAmount;

    @DecimalMin(value = "0.00", message = "Interest rate must not be negative")
    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @Min(value = 1, message = "Term must be at least one month")
    @JsonProperty("term_months")
    Integer termMonths;

    @JsonProperty("status")
    ApplicationStatus status;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("rejection_reason")
    String rejectionReason;
}
