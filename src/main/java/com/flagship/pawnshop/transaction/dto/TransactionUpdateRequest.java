package com.flagship.pawnshop.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.transaction.TransactionStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TransactionUpdateRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("status")
    TransactionStatus status;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;
}
