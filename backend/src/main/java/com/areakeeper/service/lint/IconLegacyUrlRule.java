package com.areakeeper.service.lint;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags icons not hosted at {@code {iconBaseUrl}{areaId}.{ext}}. Moving the image requires the
 * external store, so the core reports it without offering a fix.
 */
public class IconLegacyUrlRule implements LintRule {

    private static final Pattern FILE_EXTENSION = Pattern.compile("^\\.\\w+$");

    private final String iconBaseUrl;

    public IconLegacyUrlRule(String iconBaseUrl) {
        this.iconBaseUrl = iconBaseUrl;
    }

    @Override
    public String id() {
        return "icon-legacy-url";
    }

    @Override
    public String name() {
        return "Legacy Icon URL";
    }

    @Override
    public String description() {
        return "Icon is not hosted on the standard " + iconBaseUrl + " location";
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }

    @Override
    public Optional<LintIssue> evaluate(NormalizedRecord record) {
        Optional<String> icon = record.text(IconMissingRule.ICON_TAG)
            .filter(v -> !IconMissingRule.PENDING_UPLOAD.equals(v));
        if (icon.isEmpty()) {
            return Optional.empty();
        }
        String expectedPrefix = iconBaseUrl + record.id();
        if (icon.get().startsWith(expectedPrefix)
            && FILE_EXTENSION.matcher(icon.get().substring(expectedPrefix.length())).matches()) {
            return Optional.empty();
        }
        return Optional.of(issue(record, "Icon URL does not match expected format", icon.get()));
    }
}
