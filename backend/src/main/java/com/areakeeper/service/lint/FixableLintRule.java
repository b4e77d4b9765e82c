package com.areakeeper.service.lint;

import com.areakeeper.domain.NormalizedRecord;

/**
 * A {@link LintRule} with a machine-applicable fix. The returned record is a proposal: callers must
 * run it through validation again before treating it as valid.
 */
public interface FixableLintRule extends LintRule {

    NormalizedRecord autofix(NormalizedRecord record);
}
