package com.areakeeper.service.lint;

import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Builds the process-wide rule registry. Order here is the order issues are reported in.
 *
 * In tests, the {@link Clock} can be replaced by @MockBean(Clock.class).
 */
@Factory
public class LintRuleSetFactory {

    private static final Logger log = LoggerFactory.getLogger(LintRuleSetFactory.class);

    @Singleton
    @Requires(missingBeans = Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Singleton
    public LintRuleSet lintRuleSet(Clock clock,
                                   @Value("${lint.icon-base-url:https://static.btcmap.org/images/areas/}") String iconBaseUrl,
                                   @Value("${lint.verified-max-age-days:365}") int verifiedMaxAgeDays) {
        LintRuleSet ruleSet = new LintRuleSet(List.of(
            new IconMissingRule(),
            new IconLegacyUrlRule(iconBaseUrl),
            new VerifiedStaleRule(clock, verifiedMaxAgeDays),
            new GeometryMissingRule()
        ));
        log.info("Lint rule set {} loaded with {} rules", ruleSet.version(), ruleSet.rules().size());
        return ruleSet;
    }
}
