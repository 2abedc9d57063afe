package com.correlateai.engine.exception;

/**
 * Raised when a metric series breaks its construction invariants
 * (blank name, non-increasing timestamps, non-finite values).
 */
public class InvalidSeriesException extends AnalysisException {
    public InvalidSeriesException(String message) {
        super(message);
    }
}
