package com.areakeeper.service.corpus;

import com.areakeeper.domain.AreaRecord;
import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;
import com.areakeeper.service.lint.LintCache;
import com.areakeeper.service.validator.SchemaValidationResult;
import com.areakeeper.service.validator.SchemaValidator;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Batch audit of the whole area corpus.
 *
 *   1. validate every record; invalid ones are reported with their errors and no lint issues
 *   2. lint every valid, non-deleted record through {@link LintCache}
 *   3. derive each non-country area's country from its centroid
 *   4. flag url_alias values shared by more than one valid, non-deleted area
 *
 * The latest report is kept in memory and served, filtered, by {@link #results} and {@link #summary}.
 * {@link #updateArea} replaces a single row without re-auditing the corpus.
 */
@Singleton
public class CorpusLintService {

    private static final Logger log = LoggerFactory.getLogger(CorpusLintService.class);

    public static final String URL_ALIAS_CLASH = "url-alias-clash";
    public static final String URL_ALIAS_CLASH_NAME = "URL Alias Clash";
    public static final String URL_ALIAS_CLASH_DESCRIPTION = "Multiple areas share the same url_alias";
    static final String UNKNOWN = "Unknown";

    @Inject SchemaValidator schemaValidator;
    @Inject LintCache lintCache;
    @Inject Clock clock;

    private volatile CorpusReport latest = new CorpusReport(List.of(), null, CountryIndex.build(List.of()));

    record CorpusReport(List<AreaAudit> areas, Instant auditedAt, CountryIndex countries) {}

    public synchronized List<AreaAudit> audit(List<AreaRecord> records) {
        List<SchemaValidationResult> validations = new ArrayList<>();
        List<NormalizedRecord> valid = new ArrayList<>();
        for (AreaRecord record : records) {
            SchemaValidationResult result = schemaValidator.validate(record);
            validations.add(result);
            if (result.isValid() && !record.isDeleted()) {
                valid.add(result.record());
            }
        }

        CountryIndex countries = CountryIndex.build(valid);

        List<AreaAudit> audits = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            audits.add(auditOne(records.get(i), validations.get(i), countries));
        }
        audits = detectUrlAliasClashes(audits);

        latest = new CorpusReport(List.copyOf(audits), clock.instant(), countries);
        log.info("Corpus audit: {} areas, {} invalid, {} issues",
            audits.size(),
            audits.stream().filter(a -> !a.errors().isEmpty()).count(),
            audits.stream().mapToInt(a -> a.issues().size()).sum());
        return latest.areas();
    }

    /**
     * Re-validates and re-lints one area and replaces its row in the latest report (or appends it).
     * Its country is derived again, and url_alias clashes are recomputed across the report.
     * Changing a country rebuilds the country index but leaves other areas' derived country as is.
     */
    public synchronized AreaAudit updateArea(AreaRecord record) {
        CorpusReport report = latest;
        SchemaValidationResult validation = schemaValidator.validate(record);

        CountryIndex countries = report.countries();
        List<AreaAudit> areas = new ArrayList<>(report.areas().size() + 1);
        for (AreaAudit area : report.areas()) {
            if (!area.areaId().equals(record.id())) {
                areas.add(withoutClash(area));
            }
        }
        if (record.type() == AreaType.COUNTRY) {
            List<NormalizedRecord> valid = new ArrayList<>();
            for (AreaAudit area : areas) {
                if (area.areaType() == AreaType.COUNTRY && area.errors().isEmpty() && !area.deleted()) {
                    valid.add(new NormalizedRecord(area.areaId(), AreaType.COUNTRY, area.tags(), null, null, null));
                }
            }
            if (validation.isValid()) {
                valid.add(validation.record());
            }
            countries = CountryIndex.build(valid);
        }

        AreaAudit updated = auditOne(record, validation, countries);
        int position = indexOf(report.areas(), record.id());
        if (position >= 0) {
            areas.add(position, updated);
        } else {
            areas.add(updated);
        }
        areas = detectUrlAliasClashes(areas);

        latest = new CorpusReport(List.copyOf(areas), report.auditedAt(), countries);
        log.info("Corpus report updated: area={} errors={} issues={}",
            record.id(), updated.errors().size(), updated.issues().size());
        return areas.get(position >= 0 ? position : areas.size() - 1);
    }

    public List<AreaAudit> results(AuditFilter filter) {
        return latest.areas().stream()
            .filter(a -> matchesArea(a, filter))
            .map(a -> a.withIssues(filterIssues(a.issues(), filter)))
            .filter(a -> !filter.issuesOnly() || !a.issues().isEmpty())
            .toList();
    }

    public AuditSummary summary(AuditFilter filter) {
        List<AreaAudit> filtered = results(filter);

        Map<String, Integer> byRule = new TreeMap<>();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity s : List.of(Severity.ERROR, Severity.WARNING, Severity.INFO)) {
            bySeverity.put(s.label(), 0);
        }
        Map<String, Integer> byType = new TreeMap<>();
        int issues = 0;
        for (AreaAudit area : filtered) {
            byType.merge(area.areaType().tag(), 1, Integer::sum);
            for (LintIssue issue : area.issues()) {
                byRule.merge(issue.ruleId(), 1, Integer::sum);
                bySeverity.merge(issue.severity().label(), 1, Integer::sum);
                issues++;
            }
        }

        CorpusReport report = latest;
        return new AuditSummary(
            filtered.size(),
            report.areas().size(),
            (int) report.areas().stream().filter(AreaAudit::deleted).count(),
            (int) filtered.stream().filter(a -> !a.errors().isEmpty()).count(),
            (int) filtered.stream().filter(a -> !a.issues().isEmpty()).count(),
            issues,
            byRule,
            bySeverity,
            byType,
            report.auditedAt()
        );
    }

    /** Every tag key seen in the corpus, excluding {@code geo_json}. */
    public List<String> availableTags() {
        TreeSet<String> keys = new TreeSet<>();
        for (AreaAudit area : latest.areas()) {
            keys.addAll(area.tags().keySet());
        }
        keys.remove(NormalizedRecord.GEO_JSON);
        return List.copyOf(keys);
    }

    /** Countries containing at least one non-country area, sorted by name. */
    public List<CountryRef> countriesWithCommunities() {
        List<AreaAudit> areas = latest.areas();
        TreeSet<String> withCommunities = new TreeSet<>();
        for (AreaAudit area : areas) {
            if (area.areaType() != AreaType.COUNTRY && area.countryId() != null) {
                withCommunities.add(area.countryId());
            }
        }
        return areas.stream()
            .filter(a -> a.areaType() == AreaType.COUNTRY && withCommunities.contains(a.areaId()))
            .map(a -> new CountryRef(a.areaId(), a.areaName()))
            .sorted(Comparator.comparing(c -> c.name().toLowerCase(Locale.ROOT)))
            .toList();
    }

    // ── Audit steps ─────────────────────────────────────────────────────────

    private AreaAudit auditOne(AreaRecord record, SchemaValidationResult validation, CountryIndex countries) {
        Map<String, Object> tags = validation.isValid() ? validation.record().tags() : record.tags();
        String name = Optional.ofNullable(tags.get("name")).map(Object::toString).orElse(UNKNOWN);

        String countryId = null;
        String countryName = null;
        if (record.type() != AreaType.COUNTRY) {
            Optional<CountryIndex.Country> country = validation.isValid()
                ? validation.record().tag(NormalizedRecord.GEO_JSON).flatMap(countries::locate)
                : Optional.empty();
            countryId = country.map(CountryIndex.Country::id).orElse(null);
            countryName = country.map(CountryIndex.Country::name).orElse(UNKNOWN);
        }

        List<LintIssue> issues = List.of();
        if (!record.isDeleted() && validation.isValid()) {
            issues = lintCache.getOrCompute(record.id(), validation.record());
        }
        return new AreaAudit(record.id(), name, record.type(), record.isDeleted(),
            countryId, countryName, tags, record.isDeleted() ? List.of() : validation.errors(), issues);
    }

    private List<AreaAudit> detectUrlAliasClashes(List<AreaAudit> audits) {
        Map<String, List<AreaAudit>> byAlias = new LinkedHashMap<>();
        for (AreaAudit area : audits) {
            if (area.deleted() || !area.errors().isEmpty()) continue;
            Object alias = area.tags().get("url_alias");
            if (alias != null && !alias.toString().isBlank()) {
                byAlias.computeIfAbsent(alias.toString().trim(), k -> new ArrayList<>()).add(area);
            }
        }

        Map<String, LintIssue> clashes = new LinkedHashMap<>();
        for (Map.Entry<String, List<AreaAudit>> entry : byAlias.entrySet()) {
            List<AreaAudit> sharing = entry.getValue();
            if (sharing.size() < 2) continue;
            for (AreaAudit area : sharing) {
                String others = sharing.stream()
                    .filter(other -> other != area)
                    .map(other -> other.areaId() + " (" + other.areaName() + ")")
                    .reduce((a, b) -> a + ", " + b)
                    .orElse("");
                clashes.put(area.areaId(), new LintIssue(URL_ALIAS_CLASH, area.areaId(), Severity.ERROR,
                    "Duplicate url_alias shared by " + sharing.size() + " areas, also used by: " + others,
                    false, entry.getKey()));
            }
        }
        if (!clashes.isEmpty()) {
            log.info("URL alias clash detection: {} areas affected", clashes.size());
        }

        return audits.stream()
            .map(area -> {
                LintIssue clash = clashes.get(area.areaId());
                if (clash == null) return area;
                List<LintIssue> issues = new ArrayList<>(area.issues());
                issues.add(clash);
                return area.withIssues(issues);
            })
            .toList();
    }

    private static AreaAudit withoutClash(AreaAudit area) {
        if (area.issues().stream().noneMatch(i -> URL_ALIAS_CLASH.equals(i.ruleId()))) {
            return area;
        }
        return area.withIssues(area.issues().stream().filter(i -> !URL_ALIAS_CLASH.equals(i.ruleId())).toList());
    }

    private static int indexOf(List<AreaAudit> areas, String areaId) {
        for (int i = 0; i < areas.size(); i++) {
            if (areas.get(i).areaId().equals(areaId)) return i;
        }
        return -1;
    }

    // ── Filtering ───────────────────────────────────────────────────────────

    private boolean matchesArea(AreaAudit area, AuditFilter filter) {
        if (!filter.includeDeleted() && area.deleted()) return false;
        if (filter.areaType() != null && area.areaType() != filter.areaType()) return false;
        if (filter.countryId() != null && area.areaType() != AreaType.COUNTRY
            && !filter.countryId().equals(area.countryId())) {
            return false;
        }
        for (Map.Entry<String, String> tagFilter : filter.tagFilters().entrySet()) {
            Object actual = area.tags().get(tagFilter.getKey());
            if (actual == null) return false;
            String expected = tagFilter.getValue();
            if (expected != null && !globMatches(expected, actual.toString())) return false;
        }
        return true;
    }

    private List<LintIssue> filterIssues(List<LintIssue> issues, AuditFilter filter) {
        return issues.stream()
            .filter(i -> filter.ruleId() == null || filter.ruleId().equals(i.ruleId()))
            .filter(i -> filter.severity() == null || filter.severity() == i.severity())
            .toList();
    }

    static boolean globMatches(String pattern, String value) {
        if (!pattern.contains("*") && !pattern.contains("?")) {
            return Objects.equals(pattern, value);
        }
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL).matcher(value).matches();
    }
}
