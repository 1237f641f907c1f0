package com.flagship.pawnshop.access;

import com.flagship.pawnshop.exception.AuthenticationRequiredException;
import com.flagship.pawnshop.exception.PermissionDeniedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccessControlTableTest {

    private static Caller caller(String role) {
        return new Caller(UUID.randomUUID(), "tester", role);
    }

    @AfterEach
    void clearCaller() {
        CallerContext.clear();
    }

    @Test
    @DisplayName("No caller is an authentication failure, not a permission failure")
    void missingCallerRequiresAuthentication() {
        assertThrows(AuthenticationRequiredException.class,
            () -> AccessControlTable.check(null, Permission.VIEW_LOANS));
    }

    @Test
    void unknownRoleIsInvalid() {
        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
            () -> AccessControlTable.check(caller("auditor"), Permission.VIEW_LOANS));
        assertEquals("Invalid role", e.getMessage());
    }

    @Test
    void unknownRoleIsInvalidEvenWithoutRequiredPermissions() {
        assertThrows(PermissionDeniedException.class, () -> AccessControlTable.check(caller("auditor")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"admin", "ADMIN", " Admin "})
    void roleNamesAreCaseInsensitive(String role) {
        assertDoesNotThrow(() -> AccessControlTable.check(caller(role), Permission.MANAGE_BRANCHES));
    }

    @Test
    @DisplayName("Admin holds every permission")
    void adminHoldsEverything() {
        assertEquals(EnumSet.allOf(Permission.class), AccessControlTable.permissionsFor("admin"));
        assertDoesNotThrow(() -> AccessControlTable.check(caller("admin"), Permission.values()));
    }

    @Test
    void managerCannotManageUsersOrLoans() {
        Set<Permission> manager = AccessControlTable.permissionsFor("manager");

        assertTrue(manager.contains(Permission.APPROVE_LOANS));
        assertTrue(manager.contains(Permission.VIEW_USERS));
        assertFalse(manager.contains(Permission.MANAGE_USERS));
        assertFalse(manager.contains(Permission.MANAGE_LOANS));
        assertFalse(manager.contains(Permission.MANAGE_REPORTS));
        assertFalse(manager.contains(Permission.MANAGE_BRANCHES));
    }

    @Test
    void staffPermissions() {
        assertEquals(EnumSet.of(Permission.VIEW_CUSTOMERS, Permission.VIEW_LOANS, Permission.CREATE_LOANS,
                Permission.VIEW_INVENTORY, Permission.VIEW_TRANSACTIONS, Permission.MANAGE_TRANSACTIONS),
            AccessControlTable.permissionsFor("staff"));
    }

    @Test
    @DisplayName("Manage tokens do not imply view tokens")
    void manageDoesNotImplyView() {
        assertFalse(AccessControlTable.hasPermission(caller("staff"), Permission.MANAGE_CUSTOMERS));
        assertTrue(AccessControlTable.hasPermission(caller("staff"), Permission.VIEW_CUSTOMERS));
        assertFalse(AccessControlTable.hasPermission(null, Permission.VIEW_CUSTOMERS));
    }

    @Test
    @DisplayName("The first missing permission in the order given is reported")
    void firstMissingPermissionIsReported() {
        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
            () -> AccessControlTable.check(caller("staff"), Permission.MANAGE_BRANCHES, Permission.MANAGE_CUSTOMERS));
        assertEquals("Missing required permission: manage_branches", e.getMessage());

        e = assertThrows(PermissionDeniedException.class,
            () -> AccessControlTable.check(caller("staff"), Permission.MANAGE_CUSTOMERS, Permission.MANAGE_BRANCHES));
        assertEquals("Missing required permission: manage_customers", e.getMessage());
    }

    @Test
    @DisplayName("Staff cannot approve loans")
    void staffLacksApproveLoans() {
        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
            () -> AccessControlTable.check(caller("staff"), Permission.APPROVE_LOANS));
        assertEquals("Missing required permission: approve_loans", e.getMessage());

        assertDoesNotThrow(() -> AccessControlTable.check(caller("staff"), Permission.VIEW_LOANS, Permission.CREATE_LOANS));
        assertDoesNotThrow(() -> AccessControlTable.check(caller("manager"), Permission.APPROVE_LOANS));
    }

    @Test
    void unknownRoleGrantsNothing() {
        assertTrue(AccessControlTable.permissionsFor("auditor").isEmpty());
        assertTrue(AccessControlTable.permissionsFor(null).isEmpty());
    }

    @Test
    void guardUsesCallerOfCurrentThread() {
        assertThrows(AuthenticationRequiredException.class, () -> AccessGuard.require(Permission.VIEW_LOANS));

        Caller manager = caller("manager");
        CallerContext.set(manager);

        assertSame(manager, AccessGuard.require(Permission.VIEW_LOANS, Permission.APPROVE_LOANS));
        assertThrows(PermissionDeniedException.class, () -> AccessGuard.require(Permission.MANAGE_LOANS));
    }
}
