package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.dto.PaymentRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class RedeemLoanRequest {

    @Valid
    @NotNull(message = "Redemption payment is required")
    @JsonProperty("payment")
    PaymentRequest payment;

    @JsonProperty("notes")
    String notes;
}
