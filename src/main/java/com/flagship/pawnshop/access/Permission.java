package com.flagship.pawnshop.access;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of permission tokens.
 *
 * Tokens are independent: holding a {@code manage_*} token does not imply the
 * matching {@code view_*} token. Declaration order is the order in which a guard
 * reports the first missing permission.
 */
public enum Permission {
    VIEW_USERS("view_users"),
    MANAGE_USERS("manage_users"),
    VIEW_CUSTOMERS("view_customers"),
    MANAGE_CUSTOMERS("manage_customers"),
    VIEW_LOANS("view_loans"),
    CREATE_LOANS("create_loans"),
    APPROVE_LOANS("approve_loans"),
    MANAGE_LOANS("manage_loans"),
    VIEW_INVENTORY("view_inventory"),
    MANAGE_INVENTORY("manage_inventory"),
    VIEW_TRANSACTIONS("view_transactions"),
    MANAGE_TRANSACTIONS("manage_transactions"),
    VIEW_REPORTS("view_reports"),
    MANAGE_REPORTS("manage_reports"),
    VIEW_BRANCHES("view_branches"),
    MANAGE_BRANCHES("manage_branches");

    private final String token;

    Permission(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }
}
