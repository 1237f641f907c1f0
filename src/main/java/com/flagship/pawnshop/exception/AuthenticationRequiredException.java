package com.flagship.pawnshop.exception;

/**
 * No valid session could be resolved for the request.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
