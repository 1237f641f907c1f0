package com.flagship.pawnshop.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.PaymentEntity;
import com.flagship.pawnshop.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_number")
    String paymentNumber;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(PaymentEntity payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .paymentNumber(payment.getPaymentNumber())
            .loanId(payment.getLoanId())
            .amount(payment.getAmount())
            .paymentDate(payment.getPaymentDate())
            .paymentMethod(payment.getPaymentMethod())
            .referenceNumber(payment.getReferenceNumber())
            .notes(payment.getNotes())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
