package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.loan.LoanStatus;
import com.flagship.pawnshop.payment.dto.PaymentRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateLoanRequest {

    @NotNull(message = "Customer is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotNull(message = "Item is required")
    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("application_id")
    UUID applicationId;

    @NotNull(message = "Loan amount is required")
    @DecimalMin(value = "0.01", message = "Loan amount must be greater than 0")
    @JsonProperty("loan_amount")
    BigDecimal principal;

    @NotNull(message = "Interest rate is required")
    @DecimalMin(value = "0.00", message = "Interest rate must not be negative")
    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @NotNull(message = "Term is required")
    @Min(value = 1, message = "Term must be at least one day")
    @JsonProperty("term_days")
    Integer termDays;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    /**
     * Defaults to start date plus term.
     */
    @JsonProperty("due_date")
    LocalDate dueDate;

    /**
     * PENDING (default) or ACTIVE.
     */
    @JsonProperty("status")
    LoanStatus status;

    @Valid
    @JsonProperty("initial_payment")
    PaymentRequest initialPayment;

    @JsonProperty("collateral_description")
    String collateralDescription;

    @JsonProperty("notes")
    String notes;
}
