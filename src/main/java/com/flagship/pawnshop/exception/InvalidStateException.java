package com.flagship.pawnshop.exception;

import lombok.Getter;

/**
 * Thrown when an operation is not legal for the current lifecycle state of an entity,
 * e.g. redeeming a completed loan or cancelling a completed transaction.
 *
 * Carries the current status so the caller can see why the request was refused.
 */
@Getter
public class InvalidStateException extends IllegalStateException {

    private final String currentStatus;

    public InvalidStateException(String message, Enum<?> currentStatus) {
        super(message);
        this.currentStatus = currentStatus != null ? currentStatus.name() : null;
    }
}
