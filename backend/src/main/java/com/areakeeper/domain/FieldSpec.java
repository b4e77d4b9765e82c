package com.areakeeper.domain;

import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Declares one known tag for an area type.
 *
 * @param key           tag key, e.g. {@code population:date}
 * @param valueKind     check applied to the tag's value
 * @param required      whether the tag must be present
 * @param allowedValues canonical values for {@link ValueKind#SELECT}, matched case-insensitively
 */
public record FieldSpec(
    String key,
    ValueKind valueKind,
    boolean required,
    @Nullable List<String> allowedValues
) {

    public FieldSpec {
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : null;
    }

    public static FieldSpec required(String key, ValueKind kind) {
        return new FieldSpec(key, kind, true, null);
    }

    public static FieldSpec optional(String key, ValueKind kind) {
        return new FieldSpec(key, kind, false, null);
    }

    public static FieldSpec select(String key, boolean required, List<String> allowedValues) {
        return new FieldSpec(key, ValueKind.SELECT, required, allowedValues);
    }
}
