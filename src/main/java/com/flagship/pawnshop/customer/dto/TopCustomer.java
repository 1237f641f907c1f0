package com.flagship.pawnshop.customer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class TopCustomer {

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("customer_code")
    String customerCode;

    @JsonProperty("name")
    String name;

    @JsonProperty("loan_count")
    long loanCount;

    @JsonProperty("total_principal")
    BigDecimal totalPrincipal;
}
