package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * COMPLETED sale transactions in a date window. Days without sales are left out of
 * {@code sales_by_date}; every payment method appears in {@code sales_by_payment_method}.
 */
@Value
@Builder
public class SalesReport {

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("total_sales")
    BigDecimal totalSales;

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("average_sale_value")
    BigDecimal averageSaleValue;

    @JsonProperty("sales_by_date")
    List<DailyTotal> salesByDate;

    @JsonProperty("sales_by_payment_method")
    Map<PaymentMethod, BigDecimal> salesByPaymentMethod;

    @JsonProperty("sales_by_branch")
    Map<String, BigDecimal> salesByBranch;

    @JsonProperty("top_selling_items")
    List<TopItem> topSellingItems;

    @Value
    public static class TopItem {

        @JsonProperty("item_id")
        UUID itemId;

        @JsonProperty("name")
        String name;

        @JsonProperty("category")
        ItemCategory category;

        @JsonProperty("transaction_count")
        long transactionCount;

        @JsonProperty("total_amount")
        BigDecimal totalAmount;
    }
}
