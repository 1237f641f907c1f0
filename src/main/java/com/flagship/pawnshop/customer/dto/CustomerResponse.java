package com.flagship.pawnshop.customer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawnshop.customer.CustomerEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CustomerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("customer_code")
    String customerCode;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("email")
    String email;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("address")
    String address;

    @JsonProperty("city")
    String city;

    @JsonProperty("state")
    String state;

    @JsonProperty("country")
    String country;

    @JsonProperty("zip_code")
    String zipCode;

    @JsonProperty("id_type")
    String idType;

    @JsonProperty("id_number")
    String idNumber;

    @JsonProperty("id_expiry")
    LocalDate idExpiry;

    @JsonProperty("date_of_birth")
    LocalDate dateOfBirth;

    @JsonProperty("credit_score")
    Integer creditScore;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CustomerResponse from(CustomerEntity customer) {
        return CustomerResponse.builder()
            .id(customer.getId())
            .customerCode(customer.getCustomerCode())
            .firstName(customer.getFirstName())
            .lastName(customer.getLastName())
            .email(customer.getEmail())
            .phone(customer.getPhone())
            .address(customer.getAddress())
            .city(customer.getCity())
            .state(customer.getState())
            .country(customer.getCountry())
            .zipCode(customer.getZipCode())
            .idType(customer.getIdType())
            .idNumber(customer.getIdNumber())
            .idExpiry(customer.getIdExpiry())
            .dateOfBirth(customer.getDateOfBirth())
            .creditScore(customer.getCreditScore())
            .notes(customer.getNotes())
            .active(customer.isActive())
            .createdAt(customer.getCreatedAt())
            .updatedAt(customer.getUpdatedAt())
            .build();
    }
}
