package com.flagship.pawnshop.transaction;

import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.transaction.dto.TransactionRequest;
import com.flagship.pawnshop.transaction.dto.TransactionUpdateRequest;
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
 * A money movement recorded at the counter (sale, refund, adjustment and so on).
 *
 * Rows are written only through the transactions API; loan lifecycle operations
 * record {@code PaymentEntity} rows instead.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_status", columnList = "status"),
        @Index(name = "idx_transactions_type", columnList = "transaction_type"),
        @Index(name = "idx_transactions_date", columnList = "transaction_date"),
        @Index(name = "idx_transactions_customer", columnList = "customer_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_code", nullable = false, unique = true, updatable = false, length = 20)
    private String transactionCode;

    @Column(name = "branch_id", nullable = false)
    private UUID branchId;

    @Column(name = "customer_id")
    private UUID customerId;

    @Column(name = "employee_id")
    private UUID employeeId;

    @Column(name = "loan_id")
    private UUID loanId;

    @Column(name = "item_id")
    private UUID itemId;

    @Column(name = "payment_id")
    private UUID paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 20)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "reference_number", length = 100)
    private String referenceNumber;

    @Column(name = "transaction_date", nullable = false)
    private Instant transactionDate;

    @Column(columnDefinition = "TEXT")
    private String notes;

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

    static TransactionEntity create(String transactionCode, TransactionRequest request, Instant now) {
        return new TransactionEntity(
            UUID.randomUUID(),
            transactionCode,
            request.getBranchId(),
            request.getCustomerId(),
            request.getEmployeeId(),
            request.getLoanId(),
            request.getItemId(),
            request.getPaymentId(),
            request.getTransactionType(),
            request.getStatus() != null ? request.getStatus() : TransactionStatus.PENDING,
            request.getAmount(),
            request.getPaymentMethod(),
            request.getReferenceNumber(),
            request.getTransactionDate() != null ? request.getTransactionDate() : now,
            request.getNotes(),
            null,
            null
        );
    }

    void apply(TransactionUpdateRequest change) {
        if (change.getAmount() != null) {
            this.amount = change.getAmount();
        }
        if (change.getPaymentMethod() != null) {
            this.paymentMethod = change.getPaymentMethod();
        }
        if (change.getStatus() != null) {
            this.status = change.getStatus();
        }
        if (change.getReferenceNumber() != null) {
            this.referenceNumber = change.getReferenceNumber();
        }
        if (change.getNotes() != null) {
            this.notes = change.getNotes();
        }
    }

    /**
     * Moves to a final status, appending {@code "<Verb> on <instant>: <note>"} when a note is given.
     */
    void settle(TransactionStatus newStatus, String verb, String note, Instant at) {
        this.status = newStatus;
        if (note != null && !note.isBlank()) {
            this.notes = (notes == null ? "" : notes) + "\n" + verb + " on " + at + ": " + note;
        }
    }
}
