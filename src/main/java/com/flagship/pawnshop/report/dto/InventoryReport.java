package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of the stock, optionally for one branch.
 */
@Value
@Builder
public class InventoryReport {

    @JsonProperty("total_items")
    long totalItems;

    @JsonProperty("total_inventory_value")
    BigDecimal totalInventoryValue;

    @JsonProperty("items_by_status")
    Map<ItemStatus, Long> itemsByStatus;

    @JsonProperty("items_by_category")
    Map<ItemCategory, Long> itemsByCategory;

    @JsonProperty("items_by_branch")
    Map<String, Long> itemsByBranch;

    @JsonProperty("recently_acquired_items")
    List<ItemSummary> recentlyAcquiredItems;

    @JsonProperty("highest_value_items")
    List<ItemSummary> highestValueItems;

    @Value
    public static class ItemSummary {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("item_code")
        String itemCode;

        @JsonProperty("name")
        String name;

        @JsonProperty("category")
        ItemCategory category;

        @JsonProperty("status")
        ItemStatus status;

        @JsonProperty("appraised_value")
        BigDecimal appraisedValue;

        @JsonProperty("created_at")
        Instant createdAt;

        public static ItemSummary from(ItemEntity item) {
            return new ItemSummary(item.getId(), item.getItemCode(), item.getName(), item.getCategory(),
                item.getStatus(), item.getAppraisedValue(), item.getCreatedAt());
        }
    }
}
