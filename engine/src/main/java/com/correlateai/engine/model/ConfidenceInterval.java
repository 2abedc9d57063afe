package com.correlateai.engine.model;

public record ConfidenceInterval(double lower, double upper) {

    public double width() {
        return upper - lower;
    }
}
