package com.correlateai.engine.service;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.model.AnalysisSummary;
import com.correlateai.engine.model.ConfidenceInterval;
import com.correlateai.engine.model.ConfidenceLevel;
import com.correlateai.engine.model.CorrelationResult;
import com.correlateai.engine.model.RelationshipType;
import com.correlateai.engine.service.stats.BusinessImpactScorer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CorrelationSummaryServiceTest {

    private final CorrelationProperties properties = new CorrelationProperties();
    private final CorrelationSummaryService service =
            new CorrelationSummaryService(properties, new BusinessImpactScorer(properties));

    @Test
    void summarizesCountsAndTopFindings() {
        List<CorrelationResult> results = List.of(
                result("revenue", "ad_spend", 9.5, RelationshipType.LINEAR),
                result("traffic", "signups", 7.0, RelationshipType.LAGGED),
                result("cost", "headcount", 4.0, RelationshipType.LINEAR),
                result("temperature", "humidity", 1.5, RelationshipType.WEAK));

        AnalysisSummary summary = service.summarize(results);

        assertThat(summary.getTotalCorrelations()).isEqualTo(4);
        assertThat(summary.getHighImpactFindings()).isEqualTo(2);
        assertThat(summary.getBusinessMetricFindings()).isEqualTo(2);
        assertThat(summary.getAverageImpactScore()).isCloseTo(5.5, within(1e-12));
        assertThat(summary.getByType()).containsExactly(
                Map.entry("linear", 2), Map.entry("non-linear", 0), Map.entry("lagged", 1), Map.entry("weak", 1));
        assertThat(summary.getKeyFindings()).extracting(CorrelationResult::getMetric1)
                .containsExactly("revenue", "traffic", "cost");
    }

    @Test
    void emptyInputGivesZeroSummary() {
        AnalysisSummary summary = service.summarize(List.of());

        assertThat(summary.getTotalCorrelations()).isZero();
        assertThat(summary.getAverageImpactScore()).isZero();
        assertThat(summary.getKeyFindings()).isEmpty();
        assertThat(summary.getByType()).containsEntry("weak", 0);
    }

    private static CorrelationResult result(String metric1, String metric2, double impact, RelationshipType type) {
        return CorrelationResult.builder()
                .metric1(metric1)
                .metric2(metric2)
                .sampleSize(24)
                .lagCorrelation(Map.of())
                .businessImpactScore(impact)
                .correlationType(type)
                .confidenceInterval(new ConfidenceInterval(0, 0))
                .confidenceLevel(ConfidenceLevel.LOW)
                .build();
    }
}
