package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class DailyTotal {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("count")
    long count;
}
