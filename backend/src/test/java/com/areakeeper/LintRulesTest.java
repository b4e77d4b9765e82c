package com.areakeeper;

import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;
import com.areakeeper.service.lint.GeometryMissingRule;
import com.areakeeper.service.lint.IconLegacyUrlRule;
import com.areakeeper.service.lint.IconMissingRule;
import com.areakeeper.service.lint.VerifiedStaleRule;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LintRulesTest {

    private static final String ICONS = "https://static.btcmap.org/images/areas/";
    private final Clock clock = Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);

    private NormalizedRecord record(Map<String, Object> tags) {
        return record(tags, null);
    }

    private NormalizedRecord record(Map<String, Object> tags, OffsetDateTime updatedAt) {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put("name", "Town");
        all.putAll(tags);
        return new NormalizedRecord("42", AreaType.COMMUNITY, all, null, updatedAt, null);
    }

    // ── icon-missing ────────────────────────────────────────────────────────

    @Test
    void iconMissing_noIconOrPendingUpload_reported() {
        IconMissingRule rule = new IconMissingRule();

        assertThat(rule.evaluate(record(Map.of()))).hasValueSatisfying(i -> {
            assertThat(i.severity()).isEqualTo(Severity.ERROR);
            assertThat(i.fixable()).isFalse();
        });
        assertThat(rule.evaluate(record(Map.of("icon:square", "pending-upload")))).isPresent();
        assertThat(rule.evaluate(record(Map.of("icon:square", ICONS + "42.png")))).isEmpty();
    }

    // ── icon-legacy-url ─────────────────────────────────────────────────────

    @Test
    void iconLegacyUrl_foreignHost_reportedWithCurrentValue() {
        IconLegacyUrlRule rule = new IconLegacyUrlRule(ICONS);

        Optional<LintIssue> issue = rule.evaluate(record(Map.of("icon:square", "https://example.org/logo.png")));

        assertThat(issue).hasValueSatisfying(i -> {
            assertThat(i.severity()).isEqualTo(Severity.WARNING);
            assertThat(i.currentValue()).isEqualTo("https://example.org/logo.png");
        });
    }

    @Test
    void iconLegacyUrl_standardLocationOrNoIcon_clean() {
        IconLegacyUrlRule rule = new IconLegacyUrlRule(ICONS);

        assertThat(rule.evaluate(record(Map.of("icon:square", ICONS + "42.webp")))).isEmpty();
        assertThat(rule.evaluate(record(Map.of()))).isEmpty();
        assertThat(rule.evaluate(record(Map.of("icon:square", ICONS + "7.png")))).isPresent();
        assertThat(rule.evaluate(record(Map.of("icon:square", ICONS + "420.png")))).isPresent();
        assertThat(rule.evaluate(record(Map.of("icon:square", ICONS + "42")))).isPresent();
        assertThat(rule.evaluate(record(Map.of("icon:square", ICONS + "42.png?v=2")))).isPresent();
    }

    // ── verified-stale ──────────────────────────────────────────────────────

    @Test
    void verifiedStale_oldDate_reportedAndFixable() {
        VerifiedStaleRule rule = new VerifiedStaleRule(clock, 365);

        Optional<LintIssue> issue = rule.evaluate(record(Map.of("verified:date", LocalDate.of(2024, 1, 1))));

        assertThat(issue).hasValueSatisfying(i -> {
            assertThat(i.fixable()).isTrue();
            assertThat(i.currentValue()).isEqualTo("2024-01-01");
            assertThat(i.message()).contains("over 365 days");
        });
    }

    @Test
    void verifiedStale_recentDate_clean() {
        VerifiedStaleRule rule = new VerifiedStaleRule(clock, 365);

        assertThat(rule.evaluate(record(Map.of("verified:date", LocalDate.of(2026, 1, 1))))).isEmpty();
    }

    @Test
    void verifiedStale_fallsBackToUpdatedAt() {
        VerifiedStaleRule rule = new VerifiedStaleRule(clock, 365);

        assertThat(rule.evaluate(record(Map.of(), OffsetDateTime.parse("2026-05-01T00:00:00Z")))).isEmpty();
        assertThat(rule.evaluate(record(Map.of()))).hasValueSatisfying(i ->
            assertThat(i.message()).isEqualTo("No verification date found"));
    }

    @Test
    void verifiedStale_autofix_stampsToday() {
        VerifiedStaleRule rule = new VerifiedStaleRule(clock, 365);

        NormalizedRecord fixed = rule.autofix(record(Map.of("verified:date", LocalDate.of(2020, 1, 1))));

        assertThat(fixed.tag("verified:date")).contains(LocalDate.of(2026, 6, 1));
        assertThat(rule.evaluate(fixed)).isEmpty();
    }

    // ── geometry-missing ────────────────────────────────────────────────────

    @Test
    void geometryMissing_onlyWithoutBoundary() {
        GeometryMissingRule rule = new GeometryMissingRule();

        assertThat(rule.evaluate(record(Map.of()))).hasValueSatisfying(i ->
            assertThat(i.severity()).isEqualTo(Severity.INFO));
        assertThat(rule.evaluate(record(Map.of("geo_json", GeoFixtures.box(0, 0, 1, 1))))).isEmpty();
    }
}
