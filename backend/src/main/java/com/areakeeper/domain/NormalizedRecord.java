package com.areakeeper.domain;

import jakarta.annotation.Nullable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An {@link AreaRecord} whose known tags carry canonical typed values:
 *
 *   Integer     → {@link Integer}, whatever integral type or digit string was supplied
 *   Number      → {@link BigDecimal} with scale 2
 *   Date        → {@link java.time.LocalDate}
 *   Geometry    → rewound GeoJSON as an ordered {@code Map<String, Object>}
 *   everything else → trimmed {@link String}
 *
 * Unknown tags pass through unchanged.
 */
public record NormalizedRecord(
    String id,
    AreaType type,
    Map<String, Object> tags,
    @Nullable OffsetDateTime createdAt,
    @Nullable OffsetDateTime updatedAt,
    @Nullable OffsetDateTime deletedAt
) {

    public static final String GEO_JSON = "geo_json";
    public static final String AREA_KM2 = "area_km2";

    public NormalizedRecord {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public Optional<Object> tag(String key) {
        return Optional.ofNullable(tags.get(key));
    }

    /** String form of a tag; blank values count as absent. */
    public Optional<String> text(String key) {
        return tag(key).map(Object::toString).filter(s -> !s.isBlank());
    }

    public Optional<BigDecimal> areaKm2() {
        return tag(AREA_KM2).filter(BigDecimal.class::isInstance).map(BigDecimal.class::cast);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /** Returns a copy with {@code key} set to {@code value}, keeping tag order. */
    public NormalizedRecord withTag(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(tags);
        copy.put(key, value);
        return new NormalizedRecord(id, type, copy, createdAt, updatedAt, deletedAt);
    }

    /** Feeds this record back into validation, e.g. after an autofix. */
    public AreaRecord toAreaRecord() {
        return new AreaRecord(id, type, tags, createdAt, updatedAt, deletedAt);
    }
}
