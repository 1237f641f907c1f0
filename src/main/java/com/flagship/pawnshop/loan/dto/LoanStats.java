package com.flagship.pawnshop.loan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.loan.LoanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class LoanStats {

    @JsonProperty("total_loans")
    long totalLoans;

    @JsonProperty("active_loans")
    long activeLoans;

    @JsonProperty("completed_loans")
    long completedLoans;

    @JsonProperty("defaulted_loans")
    long defaultedLoans;

    @JsonProperty("overdue_loans")
    long overdueLoans;

    @JsonProperty("total_loan_amount")
    BigDecimal totalLoanAmount;

    /**
     * Payments received beyond the principal lent, never negative.
     */
    @JsonProperty("total_interest_earned")
    BigDecimal totalInterestEarned;

    @JsonProperty("avg_loan_amount")
    BigDecimal averageLoanAmount;

    @JsonProperty("avg_loan_term")
    BigDecimal averageLoanTerm;

    @JsonProperty("loans_by_status")
    Map<LoanStatus, Long> loansByStatus;

    @JsonProperty("loans_by_month")
    List<MonthlyLoans> loansByMonth;

    @Value
    public static class MonthlyLoans {

        /**
         * {@code YYYY-MM}.
         */
        @JsonProperty("month")
        String month;

        @JsonProperty("count")
        long count;

        @JsonProperty("amount")
        BigDecimal amount;
    }
}
