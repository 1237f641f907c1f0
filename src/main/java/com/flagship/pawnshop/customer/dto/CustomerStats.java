package com.flagship.pawnshop.customer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CustomerStats {

    @JsonProperty("total_customers")
    long totalCustomers;

    @JsonProperty("active_customers")
    long activeCustomers;

    @JsonProperty("inactive_customers")
    long inactiveCustomers;

    @JsonProperty("customers_with_active_loans")
    long customersWithActiveLoans;

    @JsonProperty("customers_with_completed_loans")
    long customersWithCompletedLoans;

    @JsonProperty("customers_with_defaulted_loans")
    long customersWithDefaultedLoans;

    @JsonProperty("new_customers_this_month")
    long newCustomersThisMonth;

    @JsonProperty("new_customers_this_year")
    long newCustomersThisYear;

    @JsonProperty("top_customers_by_loan_count")
    List<TopCustomer> topCustomersByLoanCount;

    @JsonProperty("top_customers_by_loan_amount")
    List<TopCustomer> topCustomersByLoanAmount;
}
