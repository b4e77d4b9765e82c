package com.areakeeper.service.corpus;

import io.micronaut.serde.annotation.Serdeable;

@Serdeable
public record CountryRef(String id, String name) {}
