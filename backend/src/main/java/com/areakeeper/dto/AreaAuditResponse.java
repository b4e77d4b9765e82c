package com.areakeeper.dto;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.ValidationError;
import com.areakeeper.service.corpus.AreaAudit;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

@Serdeable
@Schema(description = "Corpus audit entry for one area")
public record AreaAuditResponse(
    String areaId,
    String areaName,
    String areaType,
    boolean deleted,
    @Nullable String countryId,
    @Nullable String countryName,
    Map<String, Object> tags,
    List<ValidationError> errors,
    List<LintIssue> issues
) {

    public static AreaAuditResponse from(AreaAudit audit) {
        return new AreaAuditResponse(audit.areaId(), audit.areaName(), audit.areaType().tag(), audit.deleted(),
            audit.countryId(), audit.countryName(), WireTags.of(audit.tags()), audit.errors(), audit.issues());
    }
}
