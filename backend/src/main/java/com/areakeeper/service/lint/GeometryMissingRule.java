package com.areakeeper.service.lint;

import com.areakeeper.domain.LintIssue;
import com.areakeeper.domain.NormalizedRecord;
import com.areakeeper.domain.Severity;

import java.util.Optional;

public class GeometryMissingRule implements LintRule {

    @Override
    public String id() {
        return "geometry-missing";
    }

    @Override
    public String name() {
        return "Missing Boundary";
    }

    @Override
    public String description() {
        return "No geo_json boundary is set, so area_km2 cannot be derived";
    }

    @Override
    public Severity severity() {
        return Severity.INFO;
    }

    @Override
    public Optional<LintIssue> evaluate(NormalizedRecord record) {
        if (record.tag(NormalizedRecord.GEO_JSON).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(issue(record, "Area has no boundary geometry", null));
    }
}
