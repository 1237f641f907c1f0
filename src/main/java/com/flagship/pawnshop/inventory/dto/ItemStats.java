package com.flagship.pawnshop.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.inventory.ItemStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class ItemStats {

    @JsonProperty("total_items")
    long totalItems;

    @JsonProperty("items_by_status")
    Map<ItemStatus, Long> itemsByStatus;

    @JsonProperty("items_by_category")
    Map<ItemCategory, Long> itemsByCategory;

    @JsonProperty("total_inventory_value")
    BigDecimal totalInventoryValue;

    @JsonProperty("avg_item_value")
    BigDecimal averageItemValue;

    @JsonProperty("items_added_this_month")
    long itemsAddedThisMonth;

    @JsonProperty("items_sold_this_month")
    long itemsSoldThisMonth;
}
