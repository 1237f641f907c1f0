package com.flagship.pawnshop.loan;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;

/**
 * Pure loan arithmetic.
 *
 * Interest is flat and single-period: {@code principal * rate / 100}, regardless
 * of term length or elapsed time. The remaining balance is not floored, so an
 * overpaid loan reports a negative balance.
 */
public final class LoanCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private LoanCalculator() {
        // Utility class
    }

    public static BigDecimal interestAmount(BigDecimal principal, BigDecimal interestRate) {
        return principal.multiply(interestRate).divide(HUNDRED);
    }

    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Computes the derived figures for a loan.
     *
     * @param loan the loan (any status)
     * @param totalPaid sum of all payment amounts recorded against the loan
     * @param today the reference day
     */
    public static LoanDetails computeLoanDetails(Loan loan, BigDecimal totalPaid, LocalDate today) {
        BigDecimal paid = totalPaid != null ? totalPaid : BigDecimal.ZERO;
        BigDecimal interest = interestAmount(loan.getPrincipal(), loan.getInterestRate());
        BigDecimal remaining = loan.getPrincipal().add(interest).subtract(paid);

        LocalDate dueDate = loan.getDueDate();
        long daysUntilDue = ChronoUnit.DAYS.between(today, dueDate);
        boolean overdue = today.isAfter(dueDate);

        return new LoanDetails(
            paid,
            interest,
            remaining,
            overdue,
            Math.max(0, daysUntilDue),
            Math.max(0, -daysUntilDue)
        );
    }
}
