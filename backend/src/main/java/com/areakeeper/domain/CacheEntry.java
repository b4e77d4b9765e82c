package com.areakeeper.domain;

import java.time.Instant;
import java.util.List;

/**
 * Memoized lint result for one area. Valid for reads only while {@code fingerprint} matches the
 * fingerprint of the record being linted.
 */
public record CacheEntry(
    String areaId,
    String fingerprint,
    List<LintIssue> issues,
    Instant computedAt
) {

    public CacheEntry {
        issues = List.copyOf(issues);
    }

    public boolean matches(String currentFingerprint) {
        return fingerprint.equals(currentFingerprint);
    }
}
