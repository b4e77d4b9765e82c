package com.areakeeper.service.lint;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed, ordered registry of {@link LintRule}s. Issues are always reported in registry order.
 */
public class LintRuleSet {

    private final List<LintRule> rules;
    private final String version;

    public LintRuleSet(List<LintRule> rules) {
        Set<String> ids = new HashSet<>();
        for (LintRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate lint rule id: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
        this.version = computeVersion(this.rules);
    }

    public List<LintRule> rules() {
        return rules;
    }

    public Optional<LintRule> rule(String id) {
        return rules.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    /** Identifies the rule set's contents; part of every cache fingerprint. */
    public String version() {
        return version;
    }

    /** {@link #version()} plus every rule's {@link LintRule#evaluationContext()}, as of now. */
    public String evaluationKey() {
        StringBuilder key = new StringBuilder(version);
        for (LintRule rule : rules) {
            String context = rule.evaluationContext();
            if (!context.isEmpty()) {
                key.append('|').append(rule.id()).append('=').append(context);
            }
        }
        return key.toString();
    }

    /**
     * Applies every rule to the record.
     *
     * @throws LintRuleException if a rule throws or returns {@code null}
     */
    public List<LintIssue> evaluate(NormalizedRecord record) {
        List<LintIssue> issues = new ArrayList<>();
        for (LintRule rule : rules) {
            Optional<LintIssue> result;
            try {
                result = rule.evaluate(record);
            } catch (RuntimeException e) {
                throw new LintRuleException(rule.id(), record.id(), e);
            }
            if (result == null) {
                throw new LintRuleException(rule.id(), record.id(), "evaluate returned null");
            }
            result.ifPresent(issues::add);
        }
        return issues;
    }

    private static String computeVersion(List<LintRule> rules) {
        Hasher hasher = Hashing.sha256().newHasher();
        for (LintRule rule : rules) {
            hasher.putString(rule.id(), StandardCharsets.UTF_8)
                .putString(rule.severity().name(), StandardCharsets.UTF_8)
                .putString(rule.getClass().getName(), StandardCharsets.UTF_8)
                .putBoolean(rule.fixable());
        }
        return hasher.hash().toString().substring(0, 12);
    }
}
