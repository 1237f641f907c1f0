package com.flagship.pawnshop.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ItemStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    ItemStatus status;

    @JsonProperty("notes")
    String notes;
}
