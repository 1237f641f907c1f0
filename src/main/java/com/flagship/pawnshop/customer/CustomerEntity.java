package com.flagship.pawnshop.customer;

import com.flagship.pawnshop.customer.dto.CustomerRequest;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Pawn shop customer. Never hard-deleted: {@link #deactivate()} is the delete.
 */
@Entity
@Table(
    name = "customers",
    indexes = {
        @Index(name = "idx_customers_email", columnList = "email"),
        @Index(name = "idx_customers_phone", columnList = "phone")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_code", nullable = false, unique = true, updatable = false, length = 20)
    private String customerCode;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    private String email;

    private String phone;

    private String address;

    private String city;

    private String state;

    private String country;

    @Column(name = "zip_code")
    private String zipCode;

    @Column(name = "id_type")
    private String idType;

    @Column(name = "id_number")
    private String idNumber;

    @Column(name = "id_expiry")
    private LocalDate idExpiry;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "credit_score")
    private Integer creditScore;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "is_active", nullable = false)
    private boolean active;

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

    static CustomerEntity create(String customerCode, CustomerRequest request) {
        return new CustomerEntity(
            UUID.randomUUID(),
            customerCode,
            request.getFirstName(),
            request.getLastName(),
            request.getEmail(),
            request.getPhone(),
            request.getAddress(),
            request.getCity(),
            request.getState(),
            request.getCountry(),
            request.getZipCode(),
            request.getIdType(),
            request.getIdNumber(),
            request.getIdExpiry(),
            request.getDateOfBirth(),
            request.getCreditScore(),
            request.getNotes(),
            request.getActive() == null || request.getActive(),
            null,
            null
        );
    }

    void apply(CustomerRequest request) {
        if (request.getFirstName() != null) {
            this.firstName = request.getFirstName();
        }
        if (request.getLastName() != null) {
            this.lastName = request.getLastName();
        }
        if (request.getEmail() != null) {
            this.email = request.getEmail();
        }
        if (request.getPhone() != null) {
            this.phone = request.getPhone();
        }
        if (request.getAddress() != null) {
            this.address = request.getAddress();
        }
        if (request.getCity() != null) {
            this.city = request.getCity();
        }
        if (request.getState() != null) {
            this.state = request.getState();
        }
        if (request.getCountry() != null) {
            this.country = request.getCountry();
        }
        if (request.getZipCode() != null) {
            this.zipCode = request.getZipCode();
        }
        if (request.getIdType() != null) {
            this.idType = request.getIdType();
        }
        if (request.getIdNumber() != null) {
            this.idNumber = request.getIdNumber();
        }
        if (request.getIdExpiry() != null) {
            this.idExpiry = request.getIdExpiry();
        }
        if (request.getDateOfBirth() != null) {
            this.dateOfBirth = request.getDateOfBirth();
        }
        if (request.getCreditScore() != null) {
            this.creditScore = request.getCreditScore();
        }
        if (request.getNotes() != null) {
            this.notes = request.getNotes();
        }
        if (request.getActive() != null) {
            this.active = request.getActive();
        }
    }

    void deactivate() {
        this.active = false;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }
}
