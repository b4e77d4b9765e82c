package com.areakeeper;

import com.areakeeper.domain.AreaType;
import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;
import com.areakeeper.service.lint.LintRule;
import com.areakeeper.service.lint.LintRuleException;
import com.areakeeper.service.lint.LintRuleSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LintRuleSetTest {

    /** Reports one issue per record, or throws when {@code message} is null. */
    record StubRule(String id, Severity severity, String message) implements LintRule {
        @Override public String name() { return id; }
        @Override public String description() { return id; }

        @Override
        public Optional<LintIssue> evaluate(NormalizedRecord record) {
            if (message == null) {
                throw new IllegalStateException("boom");
            }
            return Optional.of(issue(record, message, null));
        }
    }

    private final NormalizedRecord record =
        new NormalizedRecord("a-1", AreaType.COMMUNITY, Map.of("name", "Town"), null, null, null);

    @Test
    void evaluate_reportsIssuesInRegistryOrder() {
        LintRuleSet rules = new LintRuleSet(List.of(
            new StubRule("second", Severity.INFO, "b"),
            new StubRule("first", Severity.ERROR, "a")));

        assertThat(rules.evaluate(record)).extracting(LintIssue::ruleId).containsExactly("second", "first");
    }

    @Test
    void evaluate_throwingRule_surfacesLintRuleException() {
        LintRuleSet rules = new LintRuleSet(List.of(
            new StubRule("ok", Severity.INFO, "fine"),
            new StubRule("broken", Severity.ERROR, null)));

        assertThatThrownBy(() -> rules.evaluate(record))
            .isInstanceOfSatisfying(LintRuleException.class, e -> {
                assertThat(e.getRuleId()).isEqualTo("broken");
                assertThat(e.getAreaId()).isEqualTo("a-1");
                assertThat(e.getCause()).hasMessage("boom");
            });
    }

    @Test
    void evaluate_ruleReturningNull_surfacesLintRuleException() {
        LintRuleSet rules = new LintRuleSet(List.of(new LintRule() {
            @Override public String id() { return "null-rule"; }
            @Override public String name() { return "Null"; }
            @Override public String description() { return "returns null"; }
            @Override public Severity severity() { return Severity.INFO; }
            @Override public Optional<LintIssue> evaluate(NormalizedRecord r) { return null; }
        }));

        assertThatThrownBy(() -> rules.evaluate(record)).isInstanceOf(LintRuleException.class);
    }

    @Test
    void constructor_duplicateIds_rejected() {
        assertThatThrownBy(() -> new LintRuleSet(List.of(
            new StubRule("same", Severity.INFO, "a"),
            new StubRule("same", Severity.ERROR, "b"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void version_changesWithRuleContents() {
        LintRuleSet one = new LintRuleSet(List.of(new StubRule("a", Severity.INFO, "x")));
        LintRuleSet same = new LintRuleSet(List.of(new StubRule("a", Severity.INFO, "y")));
        LintRuleSet other = new LintRuleSet(List.of(new StubRule("a", Severity.ERROR, "x")));

        assertThat(one.version()).isEqualTo(same.version());
        assertThat(one.version()).isNotEqualTo(other.version());
        assertThat(one.rule("a")).isPresent();
        assertThat(one.rule("missing")).isEmpty();
    }
}
