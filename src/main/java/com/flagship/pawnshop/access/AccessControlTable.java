package com.flagship.pawnshop.access;

import com.flagship.pawnshop.exception.AuthenticationRequiredException;
import com.flagship.pawnshop.exception.PermissionDeniedException;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Static role to permission mapping and the check applied before every guarded operation.
 *
 * Check order:
 * 1. no caller -> AuthenticationRequiredException
 * 2. role name not a built-in role -> PermissionDeniedException("Invalid role")
 * 3. first required permission (in the order given) the role lacks ->
 *    PermissionDeniedException("Missing required permission: token")
 *
 * Pure: no I/O, no Spring, safe to call from anywhere.
 */
public final class AccessControlTable {

    private AccessControlTable() {
        // Utility class
    }

    public static void check(Caller caller, Permission... required) {
        check(caller, Arrays.asList(required));
    }

    public static void check(Caller caller, List<Permission> required) {
        if (caller == null) {
            throw new AuthenticationRequiredException("Not authenticated");
        }

        BuiltInRole role = BuiltInRole.fromName(caller.getRoleName())
            .orElseThrow(() -> new PermissionDeniedException("Invalid role"));

        for (Permission permission : required) {
            if (!role.permissions().contains(permission)) {
                throw new PermissionDeniedException("Missing required permission: " + permission.token());
            }
        }
    }

    /**
     * Permissions granted to a role name; empty for unknown roles.
     */
    public static Set<Permission> permissionsFor(String roleName) {
        return BuiltInRole.fromName(roleName)
            .map(BuiltInRole::permissions)
            .orElse(Set.of());
    }

    public static boolean hasPermission(Caller caller, Permission permission) {
        return caller != null && permissionsFor(caller.getRoleName()).contains(permission);
    }
}
