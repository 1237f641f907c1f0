package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Front-page figures. "Revenue" is loan payments plus COMPLETED counter transactions.
 */
@Value
@Builder
public class DashboardStats {

    @JsonProperty("total_customers")
    long totalCustomers;

    @JsonProperty("new_customers_this_month")
    long newCustomersThisMonth;

    @JsonProperty("total_loans")
    long totalLoans;

    @JsonProperty("active_loans")
    long activeLoans;

    @JsonProperty("overdue_loans")
    long overdueLoans;

    @JsonProperty("defaulted_loans")
    long defaultedLoans;

    @JsonProperty("total_loan_amount")
    BigDecimal totalLoanAmount;

    @JsonProperty("total_interest_earned")
    BigDecimal totalInterestEarned;

    @JsonProperty("items_in_inventory")
    long itemsInInventory;

    @JsonProperty("total_inventory_value")
    BigDecimal totalInventoryValue;

    @JsonProperty("transactions_today")
    long transactionsToday;

    @JsonProperty("revenue_today")
    BigDecimal revenueToday;

    @JsonProperty("sales_today")
    BigDecimal salesToday;

    @JsonProperty("revenue_by_day")
    List<DailyRevenue> revenueByDay;

    @JsonProperty("loans_by_day")
    List<DailyLoans> loansByDay;

    @Value
    public static class DailyRevenue {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("value")
        BigDecimal value;
    }

    @Value
    public static class DailyLoans {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("count")
        long count;
    }
}
