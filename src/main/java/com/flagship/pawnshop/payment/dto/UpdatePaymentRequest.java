package com.flagship.pawnshop.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Correction of a recorded payment. Null fields are left unchanged.
 */
@Value
public class UpdatePaymentRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;
}
