package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.payment.dto.PaymentRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ExtendLoanRequest {

    @NotNull(message = "Additional days are required")
    @JsonProperty("additional_days")
    Integer additionalDays;

    /**
     * Optional extension fee, recorded before the due date moves.
     */
    @Valid
    @JsonProperty("payment")
    PaymentRequest payment;

    @JsonProperty("notes")
    String notes;
}
