package com.flagship.pawnshop.access;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.flagship.pawnshop.access.Permission.*;

/**
 * The three roles the access control table knows about, with their fixed permission sets.
 *
 * Role rows in the database only carry a name. A role whose name is not one of
 * these is stored fine but grants nothing ("Invalid role" at check time).
 */
public enum BuiltInRole {
    ADMIN("admin", EnumSet.allOf(Permission.class)),
    MANAGER("manager", EnumSet.of(
        VIEW_USERS,
        VIEW_CUSTOMERS, MANAGE_CUSTOMERS,
        VIEW_LOANS, CREATE_LOANS, APPROVE_LOANS,
        VIEW_INVENTORY, MANAGE_INVENTORY,
        VIEW_TRANSACTIONS, MANAGE_TRANSACTIONS,
        VIEW_REPORTS,
        VIEW_BRANCHES)),
    STAFF("staff", EnumSet.of(
        VIEW_CUSTOMERS,
        VIEW_LOANS, CREATE_LOANS,
        VIEW_INVENTORY,
        VIEW_TRANSACTIONS, MANAGE_TRANSACTIONS));

    private final String roleName;
    private final Set<Permission> permissions;

    BuiltInRole(String roleName, EnumSet<Permission> permissions) {
        this.roleName = roleName;
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    public String roleName() {
        return roleName;
    }

    public Set<Permission> permissions() {
        return permissions;
    }

    /**
     * Resolves a stored role name, case-insensitively.
     */
    public static Optional<BuiltInRole> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (BuiltInRole role : values()) {
            if (role.roleName.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
