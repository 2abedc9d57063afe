package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CorrelationAnalysisReport(
        List<CorrelationResult> results,
        @JsonProperty("pairs_evaluated") int pairsEvaluated,
        @JsonProperty("skipped_insufficient_data") int skippedInsufficientData,
        @JsonProperty("skipped_low_quality") int skippedLowQuality,
        @JsonProperty("skipped_failed") int skippedFailed
) {}
