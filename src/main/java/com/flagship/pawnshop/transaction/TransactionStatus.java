package com.flagship.pawnshop.transaction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Settlement state of a counter transaction.
 * COMPLETED and CANCELLED are final for the update, cancel and complete operations.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED,
    CANCELLED,
    FAILED,
    REFUNDED;

    public static final Set<TransactionStatus> FINAL = EnumSet.of(COMPLETED, CANCELLED);

    public boolean isFinal() {
        return FINAL.contains(this);
    }
}
