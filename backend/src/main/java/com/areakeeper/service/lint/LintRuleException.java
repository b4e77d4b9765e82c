package com.areakeeper.service.lint;

/**
 * A lint rule failed while evaluating or fixing a record. This is a programming defect, not a
 * finding, and aborts the request that triggered it.
 */
public class LintRuleException extends RuntimeException {

    private final String ruleId;
    private final String areaId;

    public LintRuleException(String ruleId, String areaId, Throwable cause) {
        super("Lint rule '" + ruleId + "' failed on area " + areaId + ": " + cause.getMessage(), cause);
        this.ruleId = ruleId;
        this.areaId = areaId;
    }

    public LintRuleException(String ruleId, String areaId, String message) {
        super("Lint rule '" + ruleId + "' failed on area " + areaId + ": " + message);
        this.ruleId = ruleId;
        this.areaId = areaId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getAreaId() {
        return areaId;
    }
}
