package com.flagship.pawnshop.customer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.groups.Default;
import lombok.Value;

import java.time.LocalDate;

/**
 * Customer create/update payload. On create, first name, last name and phone
 * are required; on update, null fields are left unchanged.
 */
@Value
public class CustomerRequest {

    /**
     * Validation group for creation, where the name and phone are mandatory.
     */
    public interface OnCreate extends Default {
    }

    @NotBlank(groups = OnCreate.class, message = "First name is required")
    @JsonProperty("first_name")
    String firstName;

    @NotBlank(groups = OnCreate.class, message = "Last name is required")
    @JsonProperty("last_name")
    String lastName;

    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;

    @NotBlank(groups = OnCreate.class, message = "Phone is required")
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

    @Min(300)
    @Max(850)
    @JsonProperty("credit_score")
    Integer creditScore;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("is_active")
    Boolean active;
}
