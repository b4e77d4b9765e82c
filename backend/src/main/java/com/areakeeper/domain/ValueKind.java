package com.areakeeper.domain;

public enum ValueKind {
    TEXT,
    INTEGER,
    NUMBER,
    DATE,
    URL,
    EMAIL,
    PHONE,
    SELECT,
    GEOMETRY
}
