package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelationshipType {
    LINEAR("linear"),
    NON_LINEAR("non-linear"),
    LAGGED("lagged"),
    WEAK("weak");

    private final String label;

    RelationshipType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
