package com.areakeeper.domain;

public enum ErrorKind {
    MISSING,
    TYPE_MISMATCH,
    OUT_OF_RANGE,
    FORMAT_INVALID,
    GEOMETRY_INVALID,
    NOT_ALLOWED
}
