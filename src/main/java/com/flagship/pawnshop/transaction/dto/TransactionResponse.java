package com.flagship.pawnshop.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.transaction.TransactionEntity;
import com.flagship.pawnshop.transaction.TransactionStatus;
import com.flagship.pawnshop.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_code")
    String transactionCode;

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

    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("transaction_date")
    Instant transactionDate;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    // Detail view only

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("customer_name")
    String customerName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("employee_name")
    String employeeName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("loan_code")
    String loanCode;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("item_name")
    String itemName;

    public static TransactionResponse from(TransactionEntity transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .transactionCode(transaction.getTransactionCode())
            .branchId(transaction.getBranchId())
            .customerId(transaction.getCustomerId())
            .employeeId(transaction.getEmployeeId())
            .loanId(transaction.getLoanId())
            .itemId(transaction.getItemId())
            .paymentId(transaction.getPaymentId())
            .transactionType(transaction.getType())
            .status(transaction.getStatus())
            .amount(transaction.getAmount())
            .paymentMethod(transaction.getPaymentMethod())
            .referenceNumber(transaction.getReferenceNumber())
            .transactionDate(transaction.getTransactionDate())
            .notes(transaction.getNotes())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
