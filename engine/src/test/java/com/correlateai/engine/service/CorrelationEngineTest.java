package com.correlateai.engine.service;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.config.PatternProperties;
import com.correlateai.engine.exception.AnalysisException;
import com.correlateai.engine.model.EngineReport;
import com.correlateai.engine.model.MetricDataset;
import com.correlateai.engine.service.stats.BusinessImpactScorer;
import com.correlateai.engine.util.TestAnalyzers;
import com.correlateai.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static com.correlateai.engine.util.TestSeriesFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CorrelationEngineTest {

    private final CorrelationProperties correlationProperties = new CorrelationProperties();

    private CorrelationEngine engine(PairwiseCorrelationAnalyzer pairwise, SeriesPatternAnalyzer patterns) {
        return new CorrelationEngine(pairwise, patterns,
                new CorrelationSummaryService(correlationProperties, new BusinessImpactScorer(correlationProperties)));
    }

    @Test
    void runCombinesCorrelationsPatternsAndSummary() {
        double[] revenue = TestSeriesFactory.seasonal(36, 1000, 12, 80, 12);
        MetricDataset dataset = MetricDataset.of(
                series("revenue", revenue),
                series("marketing_spend", TestSeriesFactory.affine(revenue, 0.1, 20)),
                series("temperature", TestSeriesFactory.gaussian(36, 15, 3, 77)));
        CorrelationEngine engine = engine(
                TestAnalyzers.pairwise(correlationProperties),
                TestAnalyzers.patterns(new PatternProperties()));

        EngineReport report = engine.run(dataset, null);

        assertThat(report.correlations().pairsEvaluated()).isEqualTo(3);
        assertThat(report.patterns()).hasSize(3);
        assertThat(report.summary().getTotalCorrelations()).isEqualTo(report.correlations().results().size());
        assertThat(report.summary().getKeyFindings().get(0).getMetric1()).isEqualTo("revenue");
        assertThat(report.summary().getKeyFindings().get(0).getMetric2()).isEqualTo("marketing_spend");
    }

    @Test
    void analysisFailureSurfacesAsAnalysisException() {
        PairwiseCorrelationAnalyzer pairwise = mock(PairwiseCorrelationAnalyzer.class);
        SeriesPatternAnalyzer patterns = mock(SeriesPatternAnalyzer.class);
        when(pairwise.analyzeAsync(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        when(patterns.analyzeAsync(any(), any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        MetricDataset dataset = MetricDataset.of(series("a", TestSeriesFactory.linear(12, 1, 1)));

        assertThatThrownBy(() -> engine(pairwise, patterns).run(dataset, null))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Analysis failed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void dispatchFailureSurfacesAsAnalysisException() {
        PairwiseCorrelationAnalyzer pairwise = mock(PairwiseCorrelationAnalyzer.class);
        SeriesPatternAnalyzer patterns = mock(SeriesPatternAnalyzer.class);
        when(pairwise.analyzeAsync(any(), any())).thenThrow(new RejectedExecutionException("queue full"));
        MetricDataset dataset = MetricDataset.of(series("a", TestSeriesFactory.linear(12, 1, 1)));

        assertThatThrownBy(() -> engine(pairwise, patterns).run(dataset, null))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Analysis failed")
                .hasCauseInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void unknownMetricKeepsItsMessage() {
        CorrelationEngine engine = engine(
                TestAnalyzers.pairwise(correlationProperties),
                TestAnalyzers.patterns(new PatternProperties()));
        MetricDataset dataset = MetricDataset.of(series("a", TestSeriesFactory.linear(12, 1, 1)));

        assertThatThrownBy(() -> engine.run(dataset, List.of("a", "b")))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Unknown metric: b");
    }

    @Test
    void nullDatasetIsRejected() {
        CorrelationEngine engine = engine(
                TestAnalyzers.pairwise(correlationProperties),
                TestAnalyzers.patterns(new PatternProperties()));

        assertThatThrownBy(() -> engine.run(null, null)).isInstanceOf(AnalysisException.class);
    }
}
