package com.areakeeper.service;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.ValidationError;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Validation and lint outcome for one area. {@code record} is null and {@code issues} empty when
 * the area failed validation.
 */
public record AreaLintResult(
    @Nullable NormalizedRecord record,
    List<ValidationError> errors,
    List<LintIssue> issues
) {

    public static AreaLintResult invalid(List<ValidationError> errors) {
        return new AreaLintResult(null, errors, List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
