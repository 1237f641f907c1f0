package com.flagship.pawnshop.application;

/**
 * Review state of a loan application. Only PENDING applications may be deleted.
 */
public enum ApplicationStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED
}
