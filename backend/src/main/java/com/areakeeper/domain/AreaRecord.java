package com.areakeeper.domain;

import jakarta.annotation.Nullable;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An area as supplied by the external store. Tag values are untyped: strings, numbers, or nested
 * GeoJSON objects. Never mutated; validation produces a {@link NormalizedRecord} instead.
 */
public record AreaRecord(
    String id,
    AreaType type,
    Map<String, Object> tags,
    @Nullable OffsetDateTime createdAt,
    @Nullable OffsetDateTime updatedAt,
    @Nullable OffsetDateTime deletedAt
) {

    public AreaRecord {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags != null ? tags : Map.of()));
    }

    public AreaRecord(String id, AreaType type, Map<String, Object> tags) {
        this(id, type, tags, null, null, null);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
