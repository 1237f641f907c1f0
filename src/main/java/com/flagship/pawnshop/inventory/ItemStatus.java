package com.flagship.pawnshop.inventory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Where a collateral item stands.
 */
public enum ItemStatus {
    PAWNED,
    REDEEMED,
    DEFAULTED,
    FOR_SALE,
    SOLD,
    DAMAGED,
    LOST;

    /**
     * Statuses in which an item may back a new loan.
     */
    public static final Set<ItemStatus> PLEDGEABLE = EnumSet.of(PAWNED, FOR_SALE);

    /**
     * Statuses counted as "in inventory" on the dashboard.
     */
    public static final Set<ItemStatus> IN_STOCK = EnumSet.of(PAWNED, DEFAULTED, FOR_SALE);
}
