package com.areakeeper.dto;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.ValidationError;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Serdeable
@Schema(description = "Lint issues for one area; empty when the record failed validation")
public record LintReportResponse(
    String areaId,
    boolean valid,
    List<ValidationError> errors,
    List<LintIssue> issues
) {}
