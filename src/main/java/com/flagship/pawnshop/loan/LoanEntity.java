package com.flagship.pawnshop.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for loans.
 *
 * Key design principles:
 * - No setters: state changes go through the {@link Loan} domain object and
 *   come back via {@link #updateFromDomain(Loan)}
 * - Identity and parties (id, code, customer, item, application) are not updatable
 * - Timestamps are maintained by lifecycle hooks
 */
@Entity
@Table(
    name = "loans",
    indexes = {
        @Index(name = "idx_loans_customer_status", columnList = "customer_id, status"),
        @Index(name = "idx_loans_item_status", columnList = "item_id, status"),
        @Index(name = "idx_loans_due_date", columnList = "due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_code", nullable = false, unique = true, updatable = false, length = 20)
    private String loanCode;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "application_id", updatable = false)
    private UUID applicationId;

    @Column(name = "principal_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal principal;

    @Column(name = "interest_rate", nullable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "term_days", nullable = false)
    private int termDays;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "extended_due_date")
    private LocalDate extendedDueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LoanStatus status;

    @Column(name = "total_paid", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalPaid;

    @Column(name = "remaining_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal remainingBalance;

    @Column(name = "extension_count", nullable = false)
    private int extensionCount;

    @Column(name = "collateral_description", columnDefinition = "TEXT")
    private String collateralDescription;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "default_date")
    private LocalDate defaultDate;

    @Column(name = "actual_end_date")
    private LocalDate actualEndDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory: the only way to create a LoanEntity.
     */
    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            loan.getId(),
            loan.getLoanCode(),
            loan.getCustomerId(),
            loan.getItemId(),
            loan.getApplicationId(),
            loan.getPrincipal(),
            loan.getInterestRate(),
            loan.getTermDays(),
            loan.getStartDate(),
            loan.getDueDate(),
            loan.getExtendedDueDate(),
            loan.getStatus(),
            loan.getTotalPaid(),
            loan.getRemainingBalance(),
            loan.getExtensionCount(),
            loan.getCollateralDescription(),
            loan.getNotes(),
            loan.getDefaultDate(),
            loan.getActualEndDate(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Loan toDomain() {
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
            .dueDate(dueDate)
            .extendedDueDate(extendedDueDate)
            .status(status)
            .totalPaid(totalPaid)
            .remainingBalance(remainingBalance)
            .extensionCount(extensionCount)
            .collateralDescription(collateralDescription)
            .notes(notes)
            .defaultDate(defaultDate)
            .actualEndDate(actualEndDate)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state of a domain loan onto this entity.
     * Identity, parties and createdAt are left untouched.
     */
    void updateFromDomain(Loan loan) {
        this.principal = loan.getPrincipal();
        this.interestRate = loan.getInterestRate();
        this.termDays = loan.getTermDays();
        this.startDate = loan.getStartDate();
        this.dueDate = loan.getDueDate();
        this.extendedDueDate = loan.getExtendedDueDate();
        this.status = loan.getStatus();
        this.totalPaid = loan.getTotalPaid();
        this.remainingBalance = loan.getRemainingBalance();
        this.extensionCount = loan.getExtensionCount();
        this.collateralDescription = loan.getCollateralDescription();
        this.notes = loan.getNotes();
        this.defaultDate = loan.getDefaultDate();
        this.actualEndDate = loan.getActualEndDate();
    }
}
