package com.areakeeper.service.validator;

import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.ValidationError;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Either a {@link NormalizedRecord} (no errors) or every error found in the record.
 */
public record SchemaValidationResult(@Nullable NormalizedRecord record, List<ValidationError> errors) {

    public SchemaValidationResult {
        errors = List.copyOf(errors);
    }

    public static SchemaValidationResult valid(NormalizedRecord record) {
        return new SchemaValidationResult(record, List.of());
    }

    public static SchemaValidationResult invalid(List<ValidationError> errors) {
        return new SchemaValidationResult(null, errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
