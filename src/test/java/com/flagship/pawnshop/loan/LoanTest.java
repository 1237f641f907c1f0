package com.flagship.pawnshop.loan;

import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.InvalidStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Status rules of the loan domain object.
 */
class LoanTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private static Loan loanIn(LoanStatus status) {
        Loan loan = Loan.originate(UUID.randomUUID(), "L-TEST0001", UUID.randomUUID(), UUID.randomUUID(), null,
            new BigDecimal("1000"), new BigDecimal("5"), 30, START, null, LoanStatus.ACTIVE, null, "first");
        return loan.toBuilder().status(status).build();
    }

    @Test
    @DisplayName("Origination defaults to PENDING and derives the due date from the term")
    void originateDefaults() {
        Loan loan = Loan.originate(UUID.randomUUID(), "L-TEST0001", UUID.randomUUID(), UUID.randomUUID(), null,
            new BigDecimal("1000"), new BigDecimal("5"), 30, START, null, null, null, null);

        assertEquals(LoanStatus.PENDING, loan.getStatus());
        assertEquals(START.plusDays(30), loan.getDueDate());
        assertEquals(0, BigDecimal.ZERO.compareTo(loan.getTotalPaid()));
        assertEquals(0, new BigDecimal("1050").compareTo(loan.getRemainingBalance()));
        assertEquals(0, loan.getExtensionCount());
    }

    @Test
    void originateRejectsTerminalInitialStatus() {
        BusinessValidationException e = assertThrows(BusinessValidationException.class, () ->
            Loan.originate(UUID.randomUUID(), "L-TEST0001", UUID.randomUUID(), UUID.randomUUID(), null,
                new BigDecimal("1000"), new BigDecimal("5"), 30, START, null, LoanStatus.COMPLETED, null, null));
        assertEquals("initial_status", e.getRule());
    }

    @Test
    void originateRejectsBadTerms() {
        assertThrows(BusinessValidationException.class, () ->
            Loan.originate(UUID.randomUUID(), "L-1", UUID.randomUUID(), UUID.randomUUID(), null,
                BigDecimal.ZERO, new BigDecimal("5"), 30, START, null, null, null, null));
        assertThrows(BusinessValidationException.class, () ->
            Loan.originate(UUID.randomUUID(), "L-1", UUID.randomUUID(), UUID.randomUUID(), null,
                new BigDecimal("100"), new BigDecimal("-1"), 30, START, null, null, null, null));
        assertThrows(BusinessValidationException.class, () ->
            Loan.originate(UUID.randomUUID(), "L-1", UUID.randomUUID(), UUID.randomUUID(), null,
                new BigDecimal("100"), new BigDecimal("5"), 30, START, START.minusDays(1), null, null, null));
    }

    @Test
    @DisplayName("Extension moves the due date, counts the extension and appends a dated note")
    void extendActiveLoan() {
        Loan loan = loanIn(LoanStatus.ACTIVE);

        Loan extended = loan.extend(15, TODAY, "customer asked");

        assertEquals(LoanStatus.EXTENDED, extended.getStatus());
        assertEquals(loan.getDueDate().plusDays(15), extended.getDueDate());
        assertEquals(extended.getDueDate(), extended.getExtendedDueDate());
        assertEquals(45, extended.getTermDays());
        assertEquals(1, extended.getExtensionCount());
        assertEquals("first\nExtended on 2024-03-15: customer asked", extended.getNotes());
        assertEquals(LoanStatus.ACTIVE, loan.getStatus());
    }

    @ParameterizedTest
    @EnumSource(value = LoanStatus.class, names = {"PENDING", "EXTENDED", "COMPLETED", "DEFAULTED", "CANCELLED"})
    void extendRejectedOutsideActiveOrOverdue(LoanStatus status) {
        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> loanIn(status).extend(10, TODAY, null));
        assertEquals(status.name(), e.getCurrentStatus());
    }

    @Test
    void extendRequiresPositiveDays() {
        BusinessValidationException e = assertThrows(BusinessValidationException.class,
            () -> loanIn(LoanStatus.ACTIVE).extend(0, TODAY, null));
        assertEquals("positive_extension", e.getRule());
    }

    @ParameterizedTest
    @EnumSource(value = LoanStatus.class, names = {"ACTIVE", "OVERDUE", "EXTENDED"})
    void redeemFromSettleableStatus(LoanStatus status) {
        Loan redeemed = loanIn(status).redeem(TODAY, null);

        assertEquals(LoanStatus.COMPLETED, redeemed.getStatus());
        assertEquals(TODAY, redeemed.getActualEndDate());
        assertEquals("first", redeemed.getNotes());
    }

    @Test
    void redeemPendingLoanIsRejected() {
        assertThrows(InvalidStateException.class, () -> loanIn(LoanStatus.PENDING).redeem(TODAY, null));
    }

    @Test
    @DisplayName("Default always appends a line with the optional reason and notes")
    void markDefaulted() {
        Loan defaulted = loanIn(LoanStatus.OVERDUE).markDefaulted(TODAY, "no contact", "sent letters");

        assertEquals(LoanStatus.DEFAULTED, defaulted.getStatus());
        assertEquals(TODAY, defaulted.getDefaultDate());
        assertEquals(TODAY, defaulted.getActualEndDate());
        assertEquals("first\nDefaulted on 2024-03-15, Reason: no contact, Notes: sent letters", defaulted.getNotes());

        Loan bare = loanIn(LoanStatus.ACTIVE).markDefaulted(TODAY, null, null);
        assertEquals("first\nDefaulted on 2024-03-15", bare.getNotes());
    }

    @Test
    @DisplayName("Default on a PENDING loan raises InvalidState")
    void defaultPendingLoanIsRejected() {
        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> loanIn(LoanStatus.PENDING).markDefaulted(TODAY, null, null));
        assertEquals("PENDING", e.getCurrentStatus());
    }

    @ParameterizedTest
    @EnumSource(value = LoanStatus.class, names = {"COMPLETED", "DEFAULTED", "CANCELLED"})
    void terminalLoansAcceptNoPayment(LoanStatus status) {
        assertThrows(InvalidStateException.class, () -> loanIn(status).requirePayable());
    }

    @ParameterizedTest
    @EnumSource(value = LoanStatus.class, names = {"PENDING", "ACTIVE", "OVERDUE", "EXTENDED"})
    void openLoansAcceptPayment(LoanStatus status) {
        assertDoesNotThrow(() -> loanIn(status).requirePayable());
    }

    @Test
    void reviseChangesOnlyGivenFields() {
        Loan loan = loanIn(LoanStatus.ACTIVE);

        Loan revised = loan.revise(new BigDecimal("1200"), null, null, null, null, "gold ring", null);

        assertEquals(0, new BigDecimal("1200").compareTo(revised.getPrincipal()));
        assertEquals(loan.getInterestRate(), revised.getInterestRate());
        assertEquals(loan.getDueDate(), revised.getDueDate());
        assertEquals("gold ring", revised.getCollateralDescription());
        assertEquals("first", revised.getNotes());
    }

    @Test
    void reviseTerminalLoanIsRejected() {
        assertThrows(InvalidStateException.class, () ->
            loanIn(LoanStatus.COMPLETED).revise(null, null, null, null, null, null, "late note"));
    }

    @Test
    void reviseRejectsDueDateBeforeStart() {
        BusinessValidationException e = assertThrows(BusinessValidationException.class, () ->
            loanIn(LoanStatus.ACTIVE).revise(null, null, null, null, START.minusDays(1), null, null));
        assertEquals("due_after_start", e.getRule());
    }

    @Test
    void manualTransitions() {
        assertEquals(LoanStatus.ACTIVE, loanIn(LoanStatus.PENDING).transitionTo(LoanStatus.ACTIVE).getStatus());
        assertEquals(LoanStatus.CANCELLED, loanIn(LoanStatus.PENDING).transitionTo(LoanStatus.CANCELLED).getStatus());
        assertEquals(LoanStatus.OVERDUE, loanIn(LoanStatus.ACTIVE).transitionTo(LoanStatus.OVERDUE).getStatus());
        assertEquals(LoanStatus.ACTIVE, loanIn(LoanStatus.OVERDUE).transitionTo(LoanStatus.ACTIVE).getStatus());

        assertThrows(InvalidStateException.class, () -> loanIn(LoanStatus.ACTIVE).transitionTo(LoanStatus.PENDING));
        assertThrows(InvalidStateException.class, () -> loanIn(LoanStatus.DEFAULTED).transitionTo(LoanStatus.ACTIVE));
    }
}
