package com.areakeeper.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of area. Determines which {@link FieldSpec}s apply to a record.
 */
public enum AreaType {
    COMMUNITY("community"),
    COUNTRY("country");

    private final String tag;

    AreaType(String tag) {
        this.tag = tag;
    }

    /** Value used for the {@code type} tag on the wire. */
    public String tag() {
        return tag;
    }

    public static Optional<AreaType> fromTag(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AreaType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
