package com.flagship.pawnshop.inventory;

import com.flagship.pawnshop.inventory.dto.ItemRequest;
import com.flagship.pawnshop.inventory.dto.ItemUpdateRequest;
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
 * Collateral item held (or once held) by the shop.
 *
 * Status is changed only through {@link #changeStatus}, called by the loan
 * lifecycle engine or the inventory status endpoint.
 */
@Entity
@Table(
    name = "items",
    indexes = {
        @Index(name = "idx_items_status", columnList = "status"),
        @Index(name = "idx_items_branch", columnList = "branch_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "item_code", nullable = false, unique = true, updatable = false, length = 20)
    private String itemCode;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ItemCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ItemStatus status;

    @Column(name = "item_condition")
    private String condition;

    @Column(name = "serial_number")
    private String serialNumber;

    @Column(name = "appraised_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal appraisedValue;

    @Column(name = "loan_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal loanValue;

    @Column(name = "sale_price", precision = 19, scale = 4)
    private BigDecimal salePrice;

    @Column(name = "storage_location")
    private String storageLocation;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "branch_id", nullable = false)
    private UUID branchId;

    @Column(name = "customer_id")
    private UUID customerId;

    @Column(name = "application_id")
    private UUID applicationId;

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

    static ItemEntity create(String itemCode, ItemRequest request) {
        return new ItemEntity(
            UUID.randomUUID(),
            itemCode,
            request.getName(),
            request.getDescription(),
            request.getCategory(),
            request.getStatus() != null ? request.getStatus() : ItemStatus.PAWNED,
            request.getCondition(),
            request.getSerialNumber(),
            request.getAppraisedValue(),
            request.getLoanValue(),
            request.getSalePrice(),
            request.getStorageLocation(),
            request.getNotes(),
            request.getBranchId(),
            request.getCustomerId(),
            request.getApplicationId(),
            null,
            null
        );
    }

    void apply(ItemUpdateRequest request) {
        if (request.getName() != null) {
            this.name = request.getName();
        }
        if (request.getDescription() != null) {
            this.description = request.getDescription();
        }
        if (request.getCategory() != null) {
            this.category = request.getCategory();
        }
        if (request.getCondition() != null) {
            this.condition = request.getCondition();
        }
        if (request.getSerialNumber() != null) {
            this.serialNumber = request.getSerialNumber();
        }
        if (request.getAppraisedValue() != null) {
            this.appraisedValue = request.getAppraisedValue();
        }
        if (request.getLoanValue() != null) {
            this.loanValue = request.getLoanValue();
        }
        if (request.getSalePrice() != null) {
            this.salePrice = request.getSalePrice();
        }
        if (request.getStorageLocation() != null) {
            this.storageLocation = request.getStorageLocation();
        }
        if (request.getNotes() != null) {
            this.notes = request.getNotes();
        }
        if (request.getBranchId() != null) {
            this.branchId = request.getBranchId();
        }
    }

    public void changeStatus(ItemStatus newStatus) {
        this.status = newStatus;
    }

    /**
     * Status change requested by an operator; non-blank notes replace the item's notes.
     */
    void changeStatus(ItemStatus newStatus, String newNotes) {
        this.status = newStatus;
        if (newNotes != null && !newNotes.isBlank()) {
            this.notes = newNotes;
        }
    }

    public boolean isPledgeable() {
        return ItemStatus.PLEDGEABLE.contains(status);
    }
}
