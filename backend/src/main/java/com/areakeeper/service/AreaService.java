package com.areakeeper.service;

import com.areakeeper.domain.AreaRecord;
import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.ErrorKind;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.ValidationError;
import com.areakeeper.dto.AreaRequest;
import com.areakeeper.dto.FixResponse;
import com.areakeeper.dto.LintReportResponse;
import com.areakeeper.dto.ValidationResponse;
import com.areakeeper.service.corpus.CorpusLintService;
import com.areakeeper.service.lint.FixableLintRule;
import com.areakeeper.service.lint.LintCache;
import com.areakeeper.service.lint.LintRule;
import com.areakeeper.service.lint.LintRuleException;
import com.areakeeper.service.lint.LintRuleSet;
import com.areakeeper.service.validator.SchemaValidationResult;
import com.areakeeper.service.validator.SchemaValidator;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Single-area entry points used by the UI/API adapter:
 *
 *   validate → field-level errors, for rejecting a write before it reaches the external store
 *   lint     → validate, then cached lint issues
 *   fix      → validate, apply the rule's autofix, validate the result again, re-lint
 *
 * A fix is only reported as applied when the fixed record passes validation; the corpus report row
 * of the area is then replaced so results and summary reflect the fix.
 */
@Singleton
public class AreaService {

    private static final Logger log = LoggerFactory.getLogger(AreaService.class);

    @Inject SchemaValidator schemaValidator;
    @Inject LintRuleSet ruleSet;
    @Inject LintCache lintCache;
    @Inject CorpusLintService corpusLintService;

    // ── Domain-level operations ─────────────────────────────────────────────

    public AreaLintResult lint(AreaRecord record) {
        SchemaValidationResult validation = schemaValidator.validate(record);
        if (!validation.isValid()) {
            return AreaLintResult.invalid(validation.errors());
        }
        NormalizedRecord normalized = validation.record();
        return new AreaLintResult(normalized, List.of(), lintCache.getOrCompute(record.id(), normalized));
    }

    public AreaLintResult applyFix(AreaRecord record, String ruleId) {
        FixableLintRule rule = fixableRule(ruleId);

        SchemaValidationResult before = schemaValidator.validate(record);
        if (!before.isValid()) {
            return AreaLintResult.invalid(before.errors());
        }

        NormalizedRecord proposed;
        try {
            proposed = rule.autofix(before.record());
        } catch (RuntimeException e) {
            throw new LintRuleException(rule.id(), record.id(), e);
        }
        if (proposed == null) {
            throw new LintRuleException(rule.id(), record.id(), "autofix returned null");
        }

        SchemaValidationResult after = schemaValidator.validate(proposed.toAreaRecord());
        if (!after.isValid()) {
            log.warn("Autofix {} produced an invalid record for area {}: {}", ruleId, record.id(), after.errors());
            return AreaLintResult.invalid(after.errors());
        }

        lintCache.invalidate(record.id());
        AreaLintResult result = new AreaLintResult(after.record(), List.of(),
            lintCache.getOrCompute(record.id(), after.record()));
        corpusLintService.updateArea(after.record().toAreaRecord());
        log.info("Autofix applied: area={} rule={} remainingIssues={}", record.id(), ruleId, result.issues().size());
        return result;
    }

    public void invalidate(String areaId) {
        lintCache.invalidate(areaId);
    }

    public List<LintRule> rules() {
        return ruleSet.rules();
    }

    // ── Adapter-facing operations ───────────────────────────────────────────

    public ValidationResponse validate(AreaRequest req) {
        Optional<AreaType> type = req.areaType();
        if (type.isEmpty()) {
            return ValidationResponse.of(req.id(), null, List.of(unknownType(req.type())));
        }
        SchemaValidationResult result = schemaValidator.validate(req.toRecord(type.get()));
        return ValidationResponse.of(req.id(), result.record(), result.errors());
    }

    public LintReportResponse lint(AreaRequest req) {
        Optional<AreaType> type = req.areaType();
        if (type.isEmpty()) {
            return new LintReportResponse(req.id(), false, List.of(unknownType(req.type())), List.of());
        }
        AreaLintResult result = lint(req.toRecord(type.get()));
        return new LintReportResponse(req.id(), result.isValid(), result.errors(), result.issues());
    }

    public FixResponse applyFix(String ruleId, AreaRequest req) {
        Optional<AreaType> type = req.areaType();
        if (type.isEmpty()) {
            fixableRule(ruleId);
            return FixResponse.of(req.id(), ruleId, null, List.of(unknownType(req.type())), List.of());
        }
        AreaLintResult result = applyFix(req.toRecord(type.get()), ruleId);
        return FixResponse.of(req.id(), ruleId, result.record(), result.errors(), result.issues());
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private FixableLintRule fixableRule(String ruleId) {
        LintRule rule = ruleSet.rule(ruleId)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Lint rule not found: " + ruleId));
        if (!(rule instanceof FixableLintRule fixable)) {
            throw new HttpStatusException(HttpStatus.CONFLICT, "Lint rule has no autofix: " + ruleId);
        }
        return fixable;
    }

    static ValidationError unknownType(String type) {
        return new ValidationError("type", ErrorKind.NOT_ALLOWED, "Invalid area type: " + type);
    }
}
