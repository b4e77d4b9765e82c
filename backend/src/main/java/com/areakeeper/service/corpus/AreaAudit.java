package com.areakeeper.service.corpus;

import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.ValidationError;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Audit outcome for one area of the corpus.
 *
 * @param tags        normalized tags when the record is valid, otherwise the raw tags
 * @param countryId   country containing the area's centroid; always null for countries
 * @param countryName name of that country, {@code Unknown} when no country contains it
 */
public record AreaAudit(
    String areaId,
    String areaName,
    AreaType areaType,
    boolean deleted,
    @Nullable String countryId,
    @Nullable String countryName,
    Map<String, Object> tags,
    List<ValidationError> errors,
    List<LintIssue> issues
) {

    public AreaAudit {
        errors = List.copyOf(errors);
        issues = List.copyOf(issues);
    }

    public AreaAudit withIssues(List<LintIssue> replacement) {
        return new AreaAudit(areaId, areaName, areaType, deleted, countryId, countryName, tags, errors, replacement);
    }
}
