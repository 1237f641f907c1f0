package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.loan.LoanStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * All criteria are optional and combined with AND. Date bounds are inclusive.
 */
@Value
public class LoanSearchRequest {

    @JsonProperty("search_term")
    String searchTerm;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @JsonProperty("start_date_from")
    LocalDate startDateFrom;

    @JsonProperty("start_date_to")
    LocalDate startDateTo;

    @JsonProperty("due_date_from")
    LocalDate dueDateFrom;

    @JsonProperty("due_date_to")
    LocalDate dueDateTo;

    @JsonProperty("is_overdue")
    Boolean overdue;
}
