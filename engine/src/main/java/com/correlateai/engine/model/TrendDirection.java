package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    public static TrendDirection fromSlope(double slope) {
        return slope > 0 ? INCREASING : DECREASING;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
