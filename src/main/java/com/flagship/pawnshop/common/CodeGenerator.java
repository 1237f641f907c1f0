package com.flagship.pawnshop.common;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Human-readable business codes for ledger rows.
 *
 * Codes are a prefix plus the first 8 hex characters of a random UUID, upper-cased.
 * Uniqueness is enforced by the database, there is no retry on a clash.
 */
public final class CodeGenerator {

    private static final DateTimeFormatter APPLICATION_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private CodeGenerator() {
        // Utility class
    }

    public static String loanCode() {
        return "L-" + randomSuffix();
    }

    public static String customerCode() {
        return "C-" + randomSuffix();
    }

    public static String itemCode() {
        return "I-" + randomSuffix();
    }

    public static String transactionCode() {
        return "T-" + randomSuffix();
    }

    public static String paymentNumber() {
        return "P-" + randomSuffix();
    }

    /**
     * Application numbers carry the filing date: {@code APP-20240131-1A2B3C4D}.
     */
    public static String applicationNumber(LocalDate date) {
        return "APP-" + date.format(APPLICATION_DATE) + "-" + randomSuffix();
    }

    private static String randomSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
