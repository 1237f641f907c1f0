package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Customer base figures. A customer belongs to every branch holding an item they pawned.
 */
@Value
@Builder
public class CustomerReport {

    @JsonProperty("total_customers")
    long totalCustomers;

    @JsonProperty("active_customers")
    long activeCustomers;

    @JsonProperty("inactive_customers")
    long inactiveCustomers;

    @JsonProperty("new_customers")
    long newCustomers;

    @JsonProperty("customers_by_branch")
    Map<String, Long> customersByBranch;

    @JsonProperty("top_customers")
    List<RankedCustomer> topCustomers;

    @JsonProperty("customer_acquisition_by_date")
    List<MonthlyCount> customerAcquisitionByDate;

    @Value
    public static class RankedCustomer {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("name")
        String name;

        @JsonProperty("email")
        String email;

        @JsonProperty("phone")
        String phone;

        @JsonProperty("loan_count")
        long loanCount;

        @JsonProperty("total_loan_amount")
        BigDecimal totalLoanAmount;
    }

    @Value
    public static class MonthlyCount {

        /** yyyy-MM */
        @JsonProperty("date")
        String month;

        @JsonProperty("count")
        long count;
    }
}
