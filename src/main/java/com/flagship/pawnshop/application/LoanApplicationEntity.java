package com.flagship.pawnshop.application;

import com.flagship.pawnshop.application.dto.ApplicationRequest;
import com.flagship.pawnshop.application.dto.ApplicationUpdateRequest;
import com.flagship.pawnshop.inventory.ItemCategory;
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
import java.util.UUID;

/**
 * A customer's request for a loan against an item not yet taken in.
 *
 * Key design principles:
 * - No setters: created through {@link #create}, changed through {@link #apply} and {@link #process}
 * - Any status change records who processed it and when
 */
@Entity
@Table(
    name = "applications",
    indexes = {
        @Index(name = "idx_applications_status", columnList = "status"),
        @Index(name = "idx_applications_branch", columnList = "branch_id"),
        @Index(name = "idx_applications_customer", columnList = "customer_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanApplicationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "application_number", nullable = false, unique = true, updatable = false, length = 30)
    private String applicationNumber;

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @Column(name = "branch_id", nullable = false)
    private UUID branchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_category", nullable = false, length = 30)
    private ItemCategory itemCategory;

    @Column(name = "item_description", nullable = false, columnDefinition = "TEXT")
    private String itemDescription;

    @Column(name = "estimated_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal estimatedValue;

    @Column(name = "loan_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal loanAmount;

    @Column(name = "interest_rate", nullable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "term_months", nullable = false)
    private int termMonths;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ApplicationStatus status;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "processed_by")
    private UUID processedBy;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

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

    static LoanApplicationEntity create(String applicationNumber, ApplicationRequest request) {
        return new LoanApplicationEntity(
            UUID.randomUUID(),
            applicationNumber,
            request.getCustomerId(),
            request.getBranchId(),
            request.getItemCategory(),
            request.getItemDescription(),
            request.getEstimatedValue(),
            request.getLoanAmount(),
            request.getInterestRate(),
            request.getTermMonths(),
            ApplicationStatus.PENDING,
            request.getNotes(),
            null,
            null,
            null,
            null,
            null
        );
    }

    /**
     * Copies the non-null fields of a change; status goes through {@link #process}.
     */
    void apply(ApplicationUpdateRequest change) {
        if (change.getCustomerId() != null) {
            this.customerId = change.getCustomerId();
        }
        if (change.getBranchId() != null) {
            this.branchId = change.getBranchId();
        }
        if (change.getItemCategory() != null) {
            this.itemCategory = change.getItemCategory();
        }
        if (change.getItemDescription() != null) {
            this.itemDescription = change.getItemDescription();
        }
        if (change.getEstimatedValue() != null) {
            this.estimatedValue = change.getEstimatedValue();
        }
        if (change.getLoanAmount() != null) {
            this.loanAmount = change.getLoanAmount();
        }
        if (change.getInterestRate() != null) {
            this.interestRate = change.getInterestRate();
        }
        if (change.getTermMonths() != null) {
            this.termMonths = change.getTermMonths();
        }
        if (change.getNotes() != null) {
            this.notes = change.getNotes();
        }
        if (change.getRejectionReason() != null) {
            this.rejectionReason = change.getRejectionReason();
        }
    }

    void process(ApplicationStatus newStatus, UUID processedBy, Instant processedAt) {
        this.status = newStatus;
        this.processedBy = processedBy;
        this.processedAt = processedAt;
    }

    public boolean isPending() {
        return status == ApplicationStatus.PENDING;
    }
}
