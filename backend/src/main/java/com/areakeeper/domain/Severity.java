package com.areakeeper.domain;

import java.util.Locale;
import java.util.Optional;

public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Severity> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (Severity s : values()) {
            if (s.label().equalsIgnoreCase(label.trim())) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
