package com.areakeeper.service.lint;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;

import java.util.Optional;

public class IconMissingRule implements LintRule {

    static final String ICON_TAG = "icon:square";
    static final String PENDING_UPLOAD = "pending-upload";

    @Override
    public String id() {
        return "icon-missing";
    }

    @Override
    public String name() {
        return "Missing Icon";
    }

    @Override
    public String description() {
        return "No icon:square tag is set for this area";
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }

    @Override
    public Optional<LintIssue> evaluate(NormalizedRecord record) {
        Optional<String> icon = record.text(ICON_TAG).filter(v -> !PENDING_UPLOAD.equals(v));
        if (icon.isPresent()) {
            return Optional.empty();
        }
        return Optional.of(issue(record, "No icon is set for this area", null));
    }
}
