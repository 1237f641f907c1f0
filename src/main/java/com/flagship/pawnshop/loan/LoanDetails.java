package com.flagship.pawnshop.loan;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived figures for a loan at a given day. Never stored as such;
 * the loan row keeps only totalPaid and remainingBalance as a cache.
 */
@Value
public class LoanDetails {
    BigDecimal totalPaid;
    BigDecimal interestAmount;
    BigDecimal remainingBalance;
    boolean overdue;
    long daysRemaining;
    long daysOverdue;

    /**
     * Amount owed in total: principal plus the flat interest.
     */
    public BigDecimal totalDue() {
        return remainingBalance.add(totalPaid);
    }

    /**
     * True once payments cover principal plus interest.
     */
    public boolean isFullyPaid() {
        return remainingBalance.signum() <= 0;
    }
}
