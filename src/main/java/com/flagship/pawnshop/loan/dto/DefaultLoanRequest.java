package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;

@Value
public class DefaultLoanRequest {

    /**
     * Defaults to today.
     */
    @JsonProperty("default_date")
    LocalDate defaultDate;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("notes")
    String notes;
}
