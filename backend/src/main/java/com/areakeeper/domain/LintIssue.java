package com.areakeeper.domain;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

/**
 * A finding produced by a lint rule for one area.
 *
 * @param currentValue the offending tag value, when there is one
 */
@Serdeable
public record LintIssue(
    String ruleId,
    String areaId,
    Severity severity,
    String message,
    boolean fixable,
    @Nullable String currentValue
) {}
