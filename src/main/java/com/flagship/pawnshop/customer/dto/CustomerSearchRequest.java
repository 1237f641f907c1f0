package com.flagship.pawnshop.customer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * All criteria are optional and combined with AND.
 * search_term matches name, email, phone and customer code.
 */
@Value
public class CustomerSearchRequest {

    @JsonProperty("search_term")
    String searchTerm;

    @JsonProperty("email")
    String email;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("customer_code")
    String customerCode;

    @JsonProperty("is_active")
    Boolean active;

    @JsonProperty("city")
    String city;

    @JsonProperty("state")
    String state;
}
