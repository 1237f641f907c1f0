package com.flagship.pawnshop.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Loans created in a date window. A loan's branch is the branch holding its item.
 * Interest collected is payments on these loans beyond their principal, never negative.
 */
@Value
@Builder
public class LoanReport {

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("total_loans")
    long totalLoans;

    @JsonProperty("total_loan_amount")
    BigDecimal totalLoanAmount;

    @JsonProperty("total_interest_collected")
    BigDecimal totalInterestCollected;

    @JsonProperty("active_loans")
    long activeLoans;

    @JsonProperty("overdue_loans")
    long overdueLoans;

    @JsonProperty("extended_loans")
    long extendedLoans;

    @JsonProperty("completed_loans")
    long completedLoans;

    @JsonProperty("defaulted_loans")
    long defaultedLoans;

    @JsonProperty("loans_by_date")
    List<DailyTotal> loansByDate;

    @JsonProperty("loans_by_branch")
    Map<String, BigDecimal> loansByBranch;

    @JsonProperty("average_loan_amount")
    BigDecimal averageLoanAmount;

    @JsonProperty("average_loan_duration")
    double averageLoanDuration;
}
