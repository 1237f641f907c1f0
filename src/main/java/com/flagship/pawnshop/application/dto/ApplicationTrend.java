package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Applications filed on one calendar day.
 */
@Value
public class ApplicationTrend {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("count")
    long count;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("total_loan_amount")
    BigDecimal totalLoanAmount;
}
