package com.flagship.pawnshop.payment;

import com.flagship.pawnshop.common.CodeGenerator;
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
 * A payment recorded against a loan.
 *
 * Key design principles:
 * - No setters: created through {@link #record}, corrected through {@link #correct}
 * - The loan and payment number never change once written
 * - Idempotency key is a persistence concern: optional, unique when present
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_loan_id", columnList = "loan_id"),
        @Index(name = "idx_payments_payment_date", columnList = "payment_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_number", nullable = false, unique = true, updatable = false, length = 20)
    private String paymentNumber;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "reference_number", length = 100)
    private String referenceNumber;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

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
     * Records a new payment. The amount must be positive; the loan's status is the caller's concern.
     */
    public static PaymentEntity record(UUID loanId, BigDecimal amount, LocalDate paymentDate,
                                       PaymentMethod method, String referenceNumber, String notes,
                                       String idempotencyKey) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        return new PaymentEntity(
            UUID.randomUUID(),
            CodeGenerator.paymentNumber(),
            loanId,
            amount,
            paymentDate,
            method != null ? method : PaymentMethod.CASH,
            referenceNumber,
            notes,
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    /**
     * Corrects a recorded payment. Null arguments leave the field unchanged.
     */
    void correct(BigDecimal amount, LocalDate paymentDate, PaymentMethod method,
                 String referenceNumber, String notes) {
        if (amount != null) {
            if (amount.signum() <= 0) {
                throw new IllegalArgumentException("Payment amount must be positive");
            }
            this.amount = amount;
        }
        if (paymentDate != null) {
            this.paymentDate = paymentDate;
        }
        if (method != null) {
            this.paymentMethod = method;
        }
        if (referenceNumber != null) {
            this.referenceNumber = referenceNumber;
        }
        if (notes != null) {
            this.notes = notes;
        }
    }
}
