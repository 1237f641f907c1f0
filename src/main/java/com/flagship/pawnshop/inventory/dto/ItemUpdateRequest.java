package com.flagship.pawnshop.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Partial update of an item. Status has its own endpoint.
 */
@Value
public class ItemUpdateRequest {

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("category")
    ItemCategory category;

    @JsonProperty("condition")
    String condition;

    @JsonProperty("serial_number")
    String serialNumber;

    @DecimalMin(value = "0.00")
    @JsonProperty("appraised_value")
    BigDecimal appraisedValue;

    @DecimalMin(value = "0.00")
    @JsonProperty("loan_value")
    BigDecimal loanValue;

    @DecimalMin(value = "0.00")
    @JsonProperty("sale_price")
    BigDecimal salePrice;

    @JsonProperty("storage_location")
    String storageLocation;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("branch_id")
    UUID branchId;
}
