package com.correlateai.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "patterns")
@Data
@Validated
public class PatternProperties {

    @Min(3)
    private int minPeriods = 12;

    @Min(4)
    private int seasonalityMinPoints = 24;

    /**
     * Evaluated in order; a later period only wins with a strictly higher score.
     */
    @NotEmpty
    private List<Integer> candidatePeriods = new ArrayList<>(List.of(12, 4, 6));

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double seasonalityThreshold = 0.3;

    @Positive
    private double anomalyIqrMultiplier = 2.0;

    @Positive
    private double changePointThreshold = 0.3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double trendSignificance = 0.05;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double forecastSignificance = 0.1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double forecastMinCorrelation = 0.3;
}
