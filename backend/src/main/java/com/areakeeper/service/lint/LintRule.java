package com.areakeeper.service.lint;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;
import jakarta.annotation.Nullable;

import java.util.Optional;

/**
 * A named check over a single normalized area.
 *
 * Implementations must be stateless and total: {@link #evaluate} never throws for a well-formed
 * record. A rule that throws is treated as a defect, see {@link LintRuleException}.
 *
 * Rules that can repair what they report implement {@link FixableLintRule}.
 */
public interface LintRule {

    /** Stable identifier, e.g. {@code icon-missing}. */
    String id();

    /** Short human-readable title. */
    String name();

    String description();

    Severity severity();

    Optional<LintIssue> evaluate(NormalizedRecord record);

    /**
     * Anything besides the record that the outcome depends on, such as today's date. Becomes part of
     * the cache fingerprint, so a cached result is dropped once this value changes.
     */
    default String evaluationContext() {
        return "";
    }

    default boolean fixable() {
        return this instanceof FixableLintRule;
    }

    default LintIssue issue(NormalizedRecord record, String message, @Nullable String currentValue) {
        return new LintIssue(id(), record.id(), severity(), message, fixable(), currentValue);
    }
}
