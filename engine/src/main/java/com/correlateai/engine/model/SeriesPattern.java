package com.correlateai.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class SeriesPattern {

    @JsonProperty("metric_name")
    String metricName;

    @JsonProperty("trend_direction")
    TrendDirection trendDirection;

    @JsonProperty("trend_strength")
    double trendStrength;

    @JsonProperty("seasonality_detected")
    boolean seasonalityDetected;

    /**
     * Period in samples; null unless seasonality was detected.
     */
    @JsonProperty("seasonal_period")
    Integer seasonalPeriod;

    @JsonProperty("volatility_score")
    double volatilityScore;

    @JsonProperty("anomaly_periods")
    List<LocalDateTime> anomalyPeriods;

    @JsonProperty("change_points")
    List<LocalDateTime> changePoints;

    @JsonProperty("forecast_direction")
    TrendDirection forecastDirection;

    @JsonProperty("confidence_level")
    double confidenceLevel;
}
