package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Every measure computed for one unordered pair of metrics.
 */
@Value
@Builder
public class CorrelationResult {

    @JsonProperty("metric1")
    String metric1;

    @JsonProperty("metric2")
    String metric2;

    @JsonProperty("sample_size")
    int sampleSize;

    @JsonProperty("pearson_correlation")
    double pearsonCorrelation;

    @JsonProperty("spearman_correlation")
    double spearmanCorrelation;

    @JsonProperty("kendall_correlation")
    double kendallCorrelation;

    @JsonProperty("mutual_information")
    double mutualInformation;

    @JsonProperty("granger_causality_p_value")
    double grangerCausalityPValue;

    /**
     * Positive lag: metric1 leads metric2. Negative lag: metric2 leads metric1.
     */
    @JsonProperty("lag_correlation")
    Map<Integer, Double> lagCorrelation;

    @JsonProperty("ml_feature_importance")
    double mlFeatureImportance;

    @JsonProperty("r_squared")
    double explainedVariance;

    @JsonProperty("statistical_significance")
    double statisticalSignificance;

    @JsonProperty("business_impact_score")
    double businessImpactScore;

    @JsonProperty("correlation_type")
    RelationshipType correlationType;

    @JsonProperty("confidence_interval")
    ConfidenceInterval confidenceInterval;

    @JsonProperty("data_quality_score")
    double dataQualityScore;

    @JsonProperty("confidence_level")
    ConfidenceLevel confidenceLevel;
}
