package com.areakeeper.service.corpus;

import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.Severity;
import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * Narrows an audit report. Null criteria match everything.
 *
 * @param tagFilters tag key → expected value; a null value only requires the tag to exist,
 *                   a value containing {@code *} or {@code ?} is matched as a glob
 */
public record AuditFilter(
    @Nullable String ruleId,
    @Nullable Severity severity,
    @Nullable AreaType areaType,
    boolean includeDeleted,
    boolean issuesOnly,
    @Nullable String countryId,
    Map<String, String> tagFilters
) {

    public AuditFilter {
        tagFilters = tagFilters != null ? tagFilters : Map.of();
    }

    public static AuditFilter all() {
        return new AuditFilter(null, null, null, false, false, null, Map.of());
    }
}
