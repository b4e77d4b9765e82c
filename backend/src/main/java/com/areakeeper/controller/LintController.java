package com.areakeeper.controller;

import com.areakeeper.domain.AreaRecord;
import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.Severity;
import com.areakeeper.dto.AreaAuditResponse;
import com.areakeeper.dto.AreaRequest;
import com.areakeeper.dto.LintRuleResponse;
import com.areakeeper.dto.LintSummaryResponse;
import com.areakeeper.service.AreaService;
import com.areakeeper.service.corpus.AuditFilter;
import com.areakeeper.service.corpus.CorpusLintService;
import com.areakeeper.service.corpus.CountryRef;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Controller("/api/v1/lint")
@Validated
@Tag(name = "lint")
public class LintController {

    @Inject
    AreaService areaService;

    @Inject
    CorpusLintService corpusLintService;

    @Get("/rules")
    @Operation(summary = "List lint rules in evaluation order")
    public HttpResponse<List<LintRuleResponse>> rules() {
        List<LintRuleResponse> rules = new ArrayList<>();
        areaService.rules().forEach(r ->
            rules.add(new LintRuleResponse(r.id(), r.name(), r.description(), r.severity(), r.fixable(), false)));
        rules.add(new LintRuleResponse(CorpusLintService.URL_ALIAS_CLASH, CorpusLintService.URL_ALIAS_CLASH_NAME,
            CorpusLintService.URL_ALIAS_CLASH_DESCRIPTION, Severity.ERROR, false, true));
        return HttpResponse.ok(rules);
    }

    @Delete("/cache/{areaId}")
    @Operation(summary = "Drop the cached lint result of an area after it changed in the store")
    public HttpResponse<Void> invalidate(String areaId) {
        areaService.invalidate(areaId);
        return HttpResponse.noContent();
    }

    @Post("/audit")
    @Operation(summary = "Audit a full corpus snapshot; records with an unknown type are skipped")
    public HttpResponse<LintSummaryResponse> audit(@Valid @Body List<@Valid AreaRequest> areas) {
        List<AreaRecord> records = new ArrayList<>(areas.size());
        List<String> skipped = new ArrayList<>();
        for (AreaRequest req : areas) {
            req.areaType().ifPresentOrElse(
                type -> records.add(req.toRecord(type)),
                () -> skipped.add(req.id()));
        }
        corpusLintService.audit(records);
        return HttpResponse.ok(LintSummaryResponse.from(corpusLintService.summary(AuditFilter.all()), skipped));
    }

    @Get("/results")
    @Operation(summary = "Audit results of the last corpus audit")
    public HttpResponse<List<AreaAuditResponse>> results(
            @Nullable @QueryValue String rule,
            @Nullable @QueryValue String severity,
            @Nullable @QueryValue String type,
            @QueryValue(defaultValue = "false") boolean includeDeleted,
            @QueryValue(defaultValue = "false") boolean issuesOnly,
            @Nullable @QueryValue String country,
            @Nullable @QueryValue List<String> tag) {
        AuditFilter filter = filter(rule, severity, type, includeDeleted, issuesOnly, country, tag);
        return HttpResponse.ok(corpusLintService.results(filter).stream().map(AreaAuditResponse::from).toList());
    }

    @Get("/summary")
    @Operation(summary = "Statistics of the last corpus audit")
    public HttpResponse<LintSummaryResponse> summary(
            @Nullable @QueryValue String rule,
            @Nullable @QueryValue String severity,
            @Nullable @QueryValue String type,
            @QueryValue(defaultValue = "false") boolean includeDeleted,
            @QueryValue(defaultValue = "false") boolean issuesOnly,
            @Nullable @QueryValue String country,
            @Nullable @QueryValue List<String> tag) {
        AuditFilter filter = filter(rule, severity, type, includeDeleted, issuesOnly, country, tag);
        return HttpResponse.ok(LintSummaryResponse.from(corpusLintService.summary(filter), List.of()));
    }

    @Get("/tags")
    @Operation(summary = "Tag keys present in the last corpus audit")
    public HttpResponse<List<String>> tags() {
        return HttpResponse.ok(corpusLintService.availableTags());
    }

    @Get("/countries")
    @Operation(summary = "Countries containing at least one audited community")
    public HttpResponse<List<CountryRef>> countries() {
        return HttpResponse.ok(corpusLintService.countriesWithCommunities());
    }

    private static AuditFilter filter(String rule, String severity, String type, boolean includeDeleted,
                                      boolean issuesOnly, String country, List<String> tags) {
        Severity sev = severity == null ? null : Severity.fromLabel(severity)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.BAD_REQUEST, "Unknown severity: " + severity));
        AreaType areaType = type == null ? null : AreaType.fromTag(type)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.BAD_REQUEST, "Unknown area type: " + type));

        // "key" requires the tag to exist, "key=value" matches its value (globs allowed)
        Map<String, String> tagFilters = new LinkedHashMap<>();
        if (tags != null) {
            for (String t : tags) {
                int eq = t.indexOf('=');
                if (eq < 0) {
                    tagFilters.put(t, null);
                } else {
                    tagFilters.put(t.substring(0, eq), t.substring(eq + 1));
                }
            }
        }
        return new AuditFilter(rule, sev, areaType, includeDeleted, issuesOnly, country, tagFilters);
    }
}
