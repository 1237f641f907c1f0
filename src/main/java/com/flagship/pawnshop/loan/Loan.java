package com.flagship.pawnshop.loan;

import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.InvalidStateException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Loan domain object.
 *
 * Key principles:
 * - Status transitions are explicit methods that validate the current status
 * - Invalid transitions throw {@link InvalidStateException} and change nothing
 * - Instances are immutable; every transition returns a new Loan
 * - Notes are append-only: transitions add a dated line, never rewrite history
 *
 * Stored totals (totalPaid, remainingBalance) are a cache refreshed via
 * {@link #withTotals(LoanDetails)}; {@link LoanCalculator} is the source of truth.
 */
@Value
@Builder(toBuilder = true)
public class Loan {
    UUID id;
    String loanCode;
    UUID customerId;
    UUID itemId;
    UUID applicationId;
    BigDecimal principal;
    BigDecimal interestRate;
    int termDays;
    LocalDate startDate;
    LocalDate dueDate;
    LocalDate extendedDueDate;
    LoanStatus status;
    BigDecimal totalPaid;
    BigDecimal remainingBalance;
    int extensionCount;
    String collateralDescription;
    String notes;
    LocalDate defaultDate;
    LocalDate actualEndDate;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new loan in PENDING or ACTIVE status with nothing paid yet.
     *
     * @throws BusinessValidationException on non-positive amounts, a negative rate,
     *         a due date before the start date, or any other initial status
     */
    public static Loan originate(UUID id, String loanCode, UUID customerId, UUID itemId, UUID applicationId,
                                 BigDecimal principal, BigDecimal interestRate, int termDays,
                                 LocalDate startDate, LocalDate dueDate, LoanStatus initialStatus,
                                 String collateralDescription, String notes) {
        LoanStatus status = initialStatus != null ? initialStatus : LoanStatus.PENDING;
        if (status != LoanStatus.PENDING && status != LoanStatus.ACTIVE) {
            throw new BusinessValidationException("initial_status",
                String.format("A new loan must start as PENDING or ACTIVE, not %s", status));
        }
        if (principal == null || principal.signum() <= 0) {
            throw new BusinessValidationException("positive_principal", "Principal amount must be greater than 0");
        }
        if (interestRate == null || interestRate.signum() < 0) {
            throw new BusinessValidationException("non_negative_rate", "Interest rate must not be negative");
        }
        if (termDays <= 0) {
            throw new BusinessValidationException("positive_term", "Term must be at least one day");
        }
        LocalDate effectiveDueDate = dueDate != null ? dueDate : startDate.plusDays(termDays);
        if (effectiveDueDate.isBefore(startDate)) {
            throw new BusinessValidationException("due_after_start", "Due date must not be before the start date");
        }

        BigDecimal interest = LoanCalculator.interestAmount(principal, interestRate);
        return Loan.builder()
            .id(id)
            .loanCode(loanCode)
            .customerId(customerId)
            .itemId(itemId)
            .applicationId(applicationId)
            .principal(principal)
            .interestRate(interestRate)
            .termDays(termDays)
            .startDate(startDate)
            .dueDate(effectiveDueDate)
            .status(status)
            .totalPaid(BigDecimal.ZERO)
            .remainingBalance(principal.add(interest))
            .extensionCount(0)
            .collateralDescription(collateralDescription)
            .notes(notes)
            .build();
    }

    /**
     * Refreshes the stored totals from freshly computed details.
     */
    public Loan withTotals(LoanDetails details) {
        return toBuilder()
            .totalPaid(details.getTotalPaid())
            .remainingBalance(details.getRemainingBalance())
            .build();
    }

    /**
     * Verifies the loan accepts a payment.
     *
     * @throws InvalidStateException unless status is PENDING, ACTIVE, OVERDUE or EXTENDED
     */
    public void requirePayable() {
        requireStatus(LoanStatus.PAYABLE, "add payment to");
    }

    /**
     * Marks the loan paid off after a payment covered principal plus interest.
     * Only valid from a payable status.
     */
    public Loan completeByPayment(LocalDate today) {
        requireStatus(LoanStatus.PAYABLE, "complete");
        return toBuilder()
            .status(LoanStatus.COMPLETED)
            .actualEndDate(today)
            .build();
    }

    /**
     * Pushes the due date back. Only valid from ACTIVE or OVERDUE.
     *
     * @param additionalDays days to add, must be positive
     * @param today date written into the note
     * @param extensionNotes optional operator note
     * @return loan in EXTENDED status with due date and term increased by additionalDays
     */
    public Loan extend(int additionalDays, LocalDate today, String extensionNotes) {
        requireStatus(LoanStatus.EXTENDABLE, "extend");
        if (additionalDays <= 0) {
            throw new BusinessValidationException("positive_extension", "Additional days must be greater than 0");
        }
        LocalDate newDueDate = dueDate.plusDays(additionalDays);
        return toBuilder()
            .dueDate(newDueDate)
            .extendedDueDate(newDueDate)
            .termDays(termDays + additionalDays)
            .extensionCount(extensionCount + 1)
            .status(LoanStatus.EXTENDED)
            .notes(hasText(extensionNotes)
                ? appendNote(String.format("Extended on %s: %s", today, extensionNotes))
                : notes)
            .build();
    }

    /**
     * Closes the loan on redemption. Only valid from ACTIVE, OVERDUE or EXTENDED.
     * The caller checks that the redemption payment covers the balance.
     */
    public Loan redeem(LocalDate today, String redemptionNotes) {
        requireStatus(LoanStatus.SETTLEABLE, "redeem");
        return toBuilder()
            .status(LoanStatus.COMPLETED)
            .actualEndDate(today)
            .notes(hasText(redemptionNotes)
                ? appendNote(String.format("Redeemed on %s: %s", today, redemptionNotes))
                : notes)
            .build();
    }

    /**
     * Forfeits the loan. Only valid from ACTIVE, OVERDUE or EXTENDED.
     * Always appends a line of the form {@code Defaulted on <date>[, Reason: r][, Notes: n]}.
     */
    public Loan markDefaulted(LocalDate onDate, String reason, String defaultNotes) {
        requireStatus(LoanStatus.SETTLEABLE, "default");
        StringBuilder line = new StringBuilder("Defaulted on ").append(onDate);
        if (hasText(reason)) {
            line.append(", Reason: ").append(reason);
        }
        if (hasText(defaultNotes)) {
            line.append(", Notes: ").append(defaultNotes);
        }
        return toBuilder()
            .status(LoanStatus.DEFAULTED)
            .defaultDate(onDate)
            .actualEndDate(onDate)
            .notes(appendNote(line.toString()))
            .build();
    }

    /**
     * Corrects the terms of a non-terminal loan. Null arguments leave the field unchanged.
     *
     * @throws InvalidStateException if the loan is terminal
     * @throws BusinessValidationException if the resulting due date precedes the start date
     */
    public Loan revise(BigDecimal newPrincipal, BigDecimal newInterestRate, Integer newTermDays,
                       LocalDate newStartDate, LocalDate newDueDate,
                       String newCollateralDescription, String newNotes) {
        if (isTerminal()) {
            throw new InvalidStateException(
                String.format("Cannot update loan in %s status", status), status);
        }
        Loan revised = toBuilder()
            .principal(newPrincipal != null ? newPrincipal : principal)
            .interestRate(newInterestRate != null ? newInterestRate : interestRate)
            .termDays(newTermDays != null ? newTermDays : termDays)
            .startDate(newStartDate != null ? newStartDate : startDate)
            .dueDate(newDueDate != null ? newDueDate : dueDate)
            .collateralDescription(newCollateralDescription != null ? newCollateralDescription : collateralDescription)
            .notes(newNotes != null ? newNotes : notes)
            .build();
        if (revised.getDueDate().isBefore(revised.getStartDate())) {
            throw new BusinessValidationException("due_after_start", "Due date must not be before the start date");
        }
        return revised;
    }

    /**
     * Applies an operator-requested status change from a loan update.
     *
     * @throws InvalidStateException if the loan is terminal or the transition is not a manual one
     */
    public Loan transitionTo(LoanStatus target) {
        if (isTerminal()) {
            throw new InvalidStateException(
                String.format("Cannot update loan in %s status", status), status);
        }
        if (!status.canTransitionManuallyTo(target)) {
            throw new InvalidStateException(
                String.format("Cannot change loan status from %s to %s", status, target), status);
        }
        return toBuilder().status(target).build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(LoanStatus target) {
        return status.canTransitionManuallyTo(target);
    }

    private void requireStatus(Set<LoanStatus> allowed, String action) {
        if (!allowed.contains(status)) {
            throw new InvalidStateException(
                String.format("Cannot %s loan in %s status. Allowed: %s", action, status, allowed), status);
        }
    }

    private String appendNote(String line) {
        return (notes == null ? "" : notes) + "\n" + line;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
