package com.flagship.pawnshop.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ApplicationStats {

    @JsonProperty("total_applications")
    long totalApplications;

    @JsonProperty("pending_count")
    long pendingCount;

    @JsonProperty("approved_count")
    long approvedCount;

    @JsonProperty("rejected_count")
    long rejectedCount;

    @JsonProperty("cancelled_count")
    long cancelledCount;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("total_loan_amount")
    BigDecimal totalLoanAmount;

    @JsonProperty("average_loan_amount")
    BigDecimal averageLoanAmount;

    @JsonProperty("average_interest_rate")
    BigDecimal averageInterestRate;

    @JsonProperty("average_term_months")
    BigDecimal averageTermMonths;
}
