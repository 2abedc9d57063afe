package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnalysisSummary {

    @JsonProperty("total_correlations")
    int totalCorrelations;

    @JsonProperty("high_impact_findings")
    int highImpactFindings;

    @JsonProperty("business_metric_findings")
    int businessMetricFindings;

    @JsonProperty("average_impact_score")
    double averageImpactScore;

    @JsonProperty("by_type")
    Map<String, Integer> byType;

    @JsonProperty("key_findings")
    List<CorrelationResult> keyFindings;
}
