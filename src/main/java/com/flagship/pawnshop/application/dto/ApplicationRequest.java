package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * New loan application. The loan amount may not exceed the estimated value.
 */
@Value
public class ApplicationRequest {

    @NotNull(message = "Customer is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotNull(message = "Branch is required")
    @JsonProperty("branch_id")
    UUID branchId;

    @NotNull(message = "Item category is required")
    @JsonProperty("item_category")
    ItemCategory itemCategory;

    @NotBlank(message = "Item description is required")
    @JsonProperty("item_description")
    String itemDescription;

    @NotNull(message = "Estimated value is required")
    @DecimalMin(value = "0.01", message = "Estimated value must be greater than 0")
    @JsonProperty("estimated_value")
    BigDecimal estimatedValue;

    @NotNull(message = "Loan amount is required")
    @DecimalMin(value = "0.01", message = "Loan amount must be greater than 0")
    @JsonProperty("loan_amount")
    BigDecimal loanAmount;

    @NotNull(message = "Interest rate is required")
    @DecimalMin(value = "0.00", message = "Interest rate must not be negative")
    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @NotNull(message = "Term is required")
    @Min(value = 1, message = "Term must be at least one month")
    @JsonProperty("term_months")
    Integer termMonths;

    @JsonProperty("notes")
    String notes;
}
