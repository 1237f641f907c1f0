package com.flagship.pawnshop.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.transaction.TransactionStatus;
import com.flagship.pawnshop.transaction.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * All criteria are optional and combined with AND.
 * search_term matches transaction code, reference number and notes.
 * Date bounds are inclusive calendar days.
 */
@Value
public class TransactionSearchRequest {

    @JsonProperty("search_term")
    String searchTerm;

    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;
}
