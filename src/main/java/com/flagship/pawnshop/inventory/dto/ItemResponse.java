package com.flagship.pawnshop.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("item_code")
    String itemCode;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("category")
    ItemCategory category;

    @JsonProperty("status")
    ItemStatus status;

    @JsonProperty("condition")
    String condition;

    @JsonProperty("serial_number")
    String serialNumber;

    @JsonProperty("appraised_value")
    BigDecimal appraisedValue;

    @JsonProperty("loan_value")
    BigDecimal loanValue;

    @JsonProperty("sale_price")
    BigDecimal salePrice;

    @JsonProperty("storage_location")
    String storageLocation;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("branch_id")
    UUID branchId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("application_id")
    UUID applicationId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ItemResponse from(ItemEntity item) {
        return ItemResponse.builder()
            .id(item.getId())
            .itemCode(item.getItemCode())
            .name(item.getName())
            .description(item.getDescription())
            .category(item.getCategory())
            .status(item.getStatus())
            .condition(item.getCondition())
            .serialNumber(item.getSerialNumber())
            .appraisedValue(item.getAppraisedValue())
            .loanValue(item.getLoanValue())
            .salePrice(item.getSalePrice())
            .storageLocation(item.getStorageLocation())
            .notes(item.getNotes())
            .branchId(item.getBranchId())
            .customerId(item.getCustomerId())
            .applicationId(item.getApplicationId())
            .createdAt(item.getCreatedAt())
            .updatedAt(item.getUpdatedAt())
            .build();
    }
}
