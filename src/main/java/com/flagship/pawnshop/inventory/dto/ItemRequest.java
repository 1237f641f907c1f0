package com.flagship.pawnshop.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.inventory.ItemStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * New collateral item.
 */
@Value
public class ItemRequest {

    @NotBlank(message = "Item name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Category is required")
    @JsonProperty("category")
    ItemCategory category;

    /**
     * Defaults to PAWNED.
     */
    @JsonProperty("status")
    ItemStatus status;

    @JsonProperty("condition")
    String condition;

    @JsonProperty("serial_number")
    String serialNumber;

    @NotNull(message = "Appraised value is required")
    @DecimalMin(value = "0.00", message = "Appraised value must not be negative")
    @JsonProperty("appraised_value")
    BigDecimal appraisedValue;

    @NotNull(message = "Loan value is required")
    @DecimalMin(value = "0.00", message = "Loan value must not be negative")
    @JsonProperty("loan_value")
    BigDecimal loanValue;

    @DecimalMin(value = "0.00", message = "Sale price must not be negative")
    @JsonProperty("sale_price")
    BigDecimal salePrice;

    @JsonProperty("storage_location")
    String storageLocation;

    @JsonProperty("notes")
    String notes;

    @NotNull(message = "Branch is required")
    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("application_id")
    UUID applicationId;
}
