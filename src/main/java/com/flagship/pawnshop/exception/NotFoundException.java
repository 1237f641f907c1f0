package com.flagship.pawnshop.exception;

import lombok.Getter;

/**
 * Thrown when a referenced entity id does not exist.
 */
@Getter
public class NotFoundException extends RuntimeException {

    private final String entity;
    private final Object id;

    public NotFoundException(String entity, Object id) {
        super(String.format("%s not found: %s", entity, id));
        this.entity = entity;
        this.id = id;
    }
}
