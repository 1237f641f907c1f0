package com.flagship.pawnshop.exception;

import lombok.Getter;

/**
 * Thrown when a request is well-formed but breaks a business rule
 * (loan amount above estimated value, insufficient redemption payment, ...).
 */
@Getter
public class BusinessValidationException extends IllegalArgumentException {

    private final String rule;

    public BusinessValidationException(String rule, String message) {
        super(message);
        this.rule = rule;
    }
}
