package com.areakeeper.dto;

import com.areakeeper.domain.Severity;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

@Serdeable
@Schema(description = "Lint rule descriptor")
public record LintRuleResponse(
    String id,
    String name,
    String description,
    Severity severity,
    boolean fixable,
    @Schema(description = "True for rules that compare areas against each other during a corpus audit")
    boolean corpusWide
) {}
