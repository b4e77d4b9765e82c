package com.areakeeper.dto;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.ValidationError;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

@Serdeable
@Schema(description = "Outcome of an autofix; the fixed record has been re-validated and re-linted")
public record FixResponse(
    String areaId,
    String ruleId,
    boolean applied,
    List<ValidationError> errors,
    @Nullable Map<String, Object> tags,
    List<LintIssue> issues
) {

    public static FixResponse of(String areaId, String ruleId, @Nullable NormalizedRecord fixed,
                                 List<ValidationError> errors, List<LintIssue> issues) {
        return new FixResponse(areaId, ruleId, fixed != null && errors.isEmpty(), errors,
            fixed != null ? WireTags.of(fixed.tags()) : null, issues);
    }
}
