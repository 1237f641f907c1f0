package com.flagship.pawnshop.exception;

/**
 * The caller is authenticated but their role does not grant the required permission.
 */
public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
