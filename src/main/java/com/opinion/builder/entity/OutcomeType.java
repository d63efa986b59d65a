package com.opinion.builder.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutcomeType {
    BINARY,
    SCALAR,
    CATEGORICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutcomeType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return BINARY;
        }
        return OutcomeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
