package com.correlateai.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "correlation")
@Data
@Validated
public class CorrelationProperties {

    /**
     * Pairs with fewer aligned points than this are skipped.
     */
    @Min(4)
    private int minDataPoints = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minQualityScore = 0.5;

    @Min(1)
    private int maxLag = 6;

    @Min(1)
    private int maxGrangerLags = 3;

    /**
     * Case-insensitive name fragments that mark a metric as business critical.
     */
    @NotNull
    private List<String> highImpactTerms = new ArrayList<>(
            List.of("revenue", "sales", "profit", "customer", "cost", "margin"));

    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private double highImpactThreshold = 7.0;

    @Min(1)
    private int summaryTopN = 3;

    private MutualInformation mutualInformation = new MutualInformation();
    private Forest forest = new Forest();

    @Data
    public static class MutualInformation {
        @Min(1)
        private int neighbors = 3;
    }

    @Data
    public static class Forest {
        @Min(1)
        private int trees = 50;

        private long seed = 42L;

        @Min(1)
        private int maxDepth = 12;

        @Min(1)
        private int minSamplesLeaf = 1;
    }
}
