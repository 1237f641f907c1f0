package com.flagship.pawnshop.loan;

import java.util.EnumSet;
import java.util.Set;

/**
 * Loan lifecycle states.
 *
 * <pre>
 * PENDING -> ACTIVE -> {OVERDUE, EXTENDED} -> {COMPLETED, DEFAULTED}
 * PENDING -> CANCELLED
 * </pre>
 *
 * COMPLETED, DEFAULTED and CANCELLED are terminal.
 */
public enum LoanStatus {
    /**
     * Created but money not yet handed over. Accepts payments; cannot be extended,
     * redeemed or defaulted.
     */
    PENDING,

    /**
     * Running loan.
     */
    ACTIVE,

    /**
     * Past its due date and not settled.
     */
    OVERDUE,

    /**
     * Due date pushed back at least once.
     */
    EXTENDED,

    /**
     * Paid in full or redeemed. Terminal.
     */
    COMPLETED,

    /**
     * Forfeited; the collateral now belongs to the shop. Terminal.
     */
    DEFAULTED,

    /**
     * Withdrawn before activation. Terminal.
     */
    CANCELLED;

    /** Statuses that accept a payment. */
    public static final Set<LoanStatus> PAYABLE = EnumSet.of(PENDING, ACTIVE, OVERDUE, EXTENDED);

    /** Statuses from which the due date can be extended. */
    public static final Set<LoanStatus> EXTENDABLE = EnumSet.of(ACTIVE, OVERDUE);

    /** Statuses from which a loan can be redeemed or defaulted. */
    public static final Set<LoanStatus> SETTLEABLE = EnumSet.of(ACTIVE, OVERDUE, EXTENDED);

    /** Statuses that block deleting the customer or the collateral item. */
    public static final Set<LoanStatus> OPEN = EnumSet.of(ACTIVE, OVERDUE);

    public boolean isTerminal() {
        return this == COMPLETED || this == DEFAULTED || this == CANCELLED;
    }

    /**
     * Transitions an operator may request directly through a loan update.
     * The engine's own transitions (extend, redeem, default, auto-complete) are not listed here.
     */
    public boolean canTransitionManuallyTo(LoanStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == ACTIVE || target == CANCELLED;
            case ACTIVE -> target == OVERDUE;
            case EXTENDED -> target == OVERDUE;
            case OVERDUE -> target == ACTIVE;
            case COMPLETED, DEFAULTED, CANCELLED -> false;
        };
    }
}
