package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
