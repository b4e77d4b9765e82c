package com.areakeeper.domain;

import io.micronaut.serde.annotation.Serdeable;

/**
 * A field-level problem with user input. Always reported back to the caller, never thrown.
 */
@Serdeable
public record ValidationError(String field, ErrorKind kind, String message) {

    public static ValidationError missing(String field) {
        return new ValidationError(field, ErrorKind.MISSING, "Missing required field: " + field);
    }

    /** Copy of this error attributed to another field. */
    public ValidationError forField(String otherField) {
        return new ValidationError(otherField, kind, message);
    }
}
