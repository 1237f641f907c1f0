package com.flagship.pawnshop.payment;

/**
 * How the customer paid.
 */
public enum PaymentMethod {
    CASH,
    CREDIT_CARD,
    DEBIT_CARD,
    BANK_TRANSFER,
    MOBILE_PAYMENT,
    CHECK,
    OTHER
}
