package com.areakeeper.dto;

import com.areakeeper.service.corpus.AuditSummary;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Serdeable
@Schema(description = "Corpus audit statistics")
public record LintSummaryResponse(
    int totalAreas,
    int totalAllAreas,
    int deletedAreas,
    int invalidAreas,
    int areasWithIssues,
    int totalIssues,
    Map<String, Integer> issuesByRule,
    Map<String, Integer> issuesBySeverity,
    Map<String, Integer> areasByType,
    @Nullable Instant lastAudit,
    @Schema(description = "Submitted records skipped because their type is unknown")
    List<String> skippedAreaIds
) {

    public static LintSummaryResponse from(AuditSummary s, List<String> skippedAreaIds) {
        return new LintSummaryResponse(s.totalAreas(), s.totalAllAreas(), s.deletedAreas(), s.invalidAreas(),
            s.areasWithIssues(), s.totalIssues(), s.issuesByRule(), s.issuesBySeverity(), s.areasByType(),
            s.lastAudit(), skippedAreaIds);
    }
}
