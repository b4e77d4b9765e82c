package com.areakeeper.service.validator;

import com.areakeeper.domain.ErrorKind;
import com.areakeeper.domain.ValidationError;
import jakarta.annotation.Nullable;

/**
 * Result of checking a single value: either a canonical value or a {@link ValidationError}.
 */
public record FieldOutcome(@Nullable Object value, @Nullable ValidationError error) {

    static final String UNATTRIBUTED = "value";

    public static FieldOutcome ok(Object value) {
        return new FieldOutcome(value, null);
    }

    public static FieldOutcome fail(ErrorKind kind, String message) {
        return new FieldOutcome(null, new ValidationError(UNATTRIBUTED, kind, message));
    }

    public boolean isValid() {
        return error == null;
    }
}
