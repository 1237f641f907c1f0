package com.flagship.pawnshop.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.inventory.ItemStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * All criteria are optional and combined with AND. Value bounds apply to the
 * appraised value; created_after/created_before are inclusive calendar days.
 */
@Value
public class ItemSearchRequest {

    @JsonProperty("search_term")
    String searchTerm;

    @JsonProperty("category")
    ItemCategory category;

    @JsonProperty("status")
    ItemStatus status;

    @JsonProperty("min_value")
    BigDecimal minValue;

    @JsonProperty("max_value")
    BigDecimal maxValue;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("created_after")
    LocalDate createdAfter;

    @JsonProperty("created_before")
    LocalDate createdBefore;
}
