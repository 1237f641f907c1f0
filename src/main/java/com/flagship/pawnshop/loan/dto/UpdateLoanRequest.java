package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.loan.LoanStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Operator correction of a non-terminal loan. Null fields are left unchanged;
 * a status is accepted only along the manual transitions.
 */
@Value
public class UpdateLoanRequest {

    @DecimalMin(value = "0.01", message = "Loan amount must be greater than 0")
    @JsonProperty("loan_amount")
    BigDecimal principal;

    @DecimalMin(value = "0.00", message = "Interest rate must not be negative")
    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @Min(value = 1, message = "Term must be at least one day")
    @JsonProperty("term_days")
    Integer termDays;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("collateral_description")
    String collateralDescription;

    @JsonProperty("notes")
    String notes;
}
