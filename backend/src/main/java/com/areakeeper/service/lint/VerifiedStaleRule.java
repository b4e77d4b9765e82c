package com.areakeeper.service.lint;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Flags areas whose {@code verified:date} (or, when absent, last update) is older than the
 * configured age. The fix stamps today's date.
 */
public class VerifiedStaleRule implements FixableLintRule {

    static final String VERIFIED_TAG = "verified:date";

    private final Clock clock;
    private final int maxAgeDays;

    public VerifiedStaleRule(Clock clock, int maxAgeDays) {
        this.clock = clock;
        this.maxAgeDays = maxAgeDays;
    }

    @Override
    public String id() {
        return "verified-stale";
    }

    @Override
    public String name() {
        return "Verification Stale";
    }

    @Override
    public String description() {
        return "Area has not been verified in over " + maxAgeDays + " days";
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }

    @Override
    public String evaluationContext() {
        return LocalDate.now(clock).toString();
    }

    @Override
    public Optional<LintIssue> evaluate(NormalizedRecord record) {
        Optional<LocalDate> verified = lastVerified(record);
        if (verified.isEmpty()) {
            return Optional.of(issue(record, "No verification date found", null));
        }
        LocalDate threshold = LocalDate.now(clock).minusDays(maxAgeDays);
        if (verified.get().isBefore(threshold)) {
            return Optional.of(issue(record,
                "Last verified " + verified.get() + ", over " + maxAgeDays + " days ago",
                verified.get().toString()));
        }
        return Optional.empty();
    }

    @Override
    public NormalizedRecord autofix(NormalizedRecord record) {
        return record.withTag(VERIFIED_TAG, LocalDate.now(clock));
    }

    private Optional<LocalDate> lastVerified(NormalizedRecord record) {
        Optional<Object> tag = record.tag(VERIFIED_TAG);
        if (tag.isPresent()) {
            Object value = tag.get();
            if (value instanceof LocalDate date) {
                return Optional.of(date);
            }
            return parse(value.toString());
        }
        OffsetDateTime updatedAt = record.updatedAt();
        return updatedAt == null
            ? Optional.empty()
            : Optional.of(updatedAt.atZoneSameInstant(ZoneOffset.UTC).toLocalDate());
    }

    private Optional<LocalDate> parse(String value) {
        try {
            return Optional.of(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(value.trim()).toLocalDate());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
