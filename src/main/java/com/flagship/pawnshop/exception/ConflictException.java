package com.flagship.pawnshop.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a delete or update is blocked by dependent records.
 * The blockers list holds the ids (or codes) of whatever is in the way.
 */
@Getter
public class ConflictException extends RuntimeException {

    private final List<String> blockers;

    public ConflictException(String message) {
        this(message, List.of());
    }

    public ConflictException(String message, List<String> blockers) {
        super(message);
        this.blockers = List.copyOf(blockers);
    }
}
