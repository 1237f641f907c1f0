package com.flagship.pawnshop.access;

/**
 * Explicit permission check for controller methods.
 *
 * Called as the first statement of a guarded handler:
 * <pre>
 *     Caller caller = AccessGuard.require(Permission.VIEW_LOANS);
 * </pre>
 */
public final class AccessGuard {

    private AccessGuard() {
        // Utility class
    }

    /**
     * Checks the current request's caller against the table and returns it.
     */
    public static Caller require(Permission... required) {
        Caller caller = CallerContext.get().orElse(null);
        AccessControlTable.check(caller, required);
        return caller;
    }
}
