package com.flagship.pawnshop.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.transaction.TransactionStatus;
import com.flagship.pawnshop.transaction.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionRequest {

    @NotNull(message = "Transaction type is required")
    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    /**
     * Defaults to PENDING.
     */
    @JsonProperty("status")
    TransactionStatus status;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @NotNull(message = "Branch is required")
    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("notes")
    String notes;

    /**
     * Defaults to the time of creation.
     */
    @JsonProperty("transaction_date")
    Instant transactionDate;
}
