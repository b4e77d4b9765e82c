package com.areakeeper.service.corpus;

import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.Map;

public record AuditSummary(
    int totalAreas,
    int totalAllAreas,
    int deletedAreas,
    int invalidAreas,
    int areasWithIssues,
    int totalIssues,
    Map<String, Integer> issuesByRule,
    Map<String, Integer> issuesBySeverity,
    Map<String, Integer> areasByType,
    @Nullable Instant lastAudit
) {}
