package com.correlateai.engine.config;

import com.correlateai.engine.model.EngineReport;
import com.correlateai.engine.model.MetricDataset;
import com.correlateai.engine.model.CorrelationAnalysisReport;
import com.correlateai.engine.model.MetricSeries;
import com.correlateai.engine.service.CorrelationEngine;
import com.correlateai.engine.service.PairwiseCorrelationAnalyzer;
import com.correlateai.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    @Qualifier("analysisExecutor")
    private Executor analysisExecutor;

    @Autowired
    private CorrelationProperties correlationProperties;

    @Autowired
    private PatternProperties patternProperties;

    @Autowired
    private CorrelationEngine correlationEngine;

    @Autowired
    private PairwiseCorrelationAnalyzer pairwiseCorrelationAnalyzer;

    @Test
    void analysisExecutorIsBounded() {
        assertThat(analysisExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) analysisExecutor;
        int processors = Runtime.getRuntime().availableProcessors();
        assertThat(executor.getCorePoolSize()).isEqualTo(Math.max(2, processors));
        assertThat(executor.getMaxPoolSize()).isEqualTo(Math.max(4, processors * 2));
        assertThat(executor.getThreadNamePrefix()).isEqualTo("analysis-");
        assertThat(executor.getQueueCapacity()).isEqualTo(500);
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    }

    @Test
    void morePairsThanQueueSlotsAreAllAnalyzed() {
        List<MetricSeries> metrics = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            metrics.add(TestSeriesFactory.series("metric_" + i, TestSeriesFactory.gaussian(36, 100, 10, 700L + i)));
        }
        MetricDataset dataset = new MetricDataset(metrics);

        CorrelationAnalysisReport report = pairwiseCorrelationAnalyzer.analyzeWithDiagnostics(dataset, null);

        assertThat(report.pairsEvaluated()).isEqualTo(780);
        assertThat(report.skippedFailed()).isZero();
        assertThat(report.results().size() + report.skippedInsufficientData() + report.skippedLowQuality())
                .isEqualTo(780);
    }

    @Test
    void propertiesBindFromApplicationYaml() {
        assertThat(correlationProperties.getMinDataPoints()).isEqualTo(10);
        assertThat(correlationProperties.getHighImpactTerms()).contains("revenue", "margin");
        assertThat(correlationProperties.getForest().getTrees()).isEqualTo(50);
        assertThat(correlationProperties.getForest().getSeed()).isEqualTo(42L);
        assertThat(patternProperties.getCandidatePeriods()).containsExactly(12, 4, 6);
        assertThat(patternProperties.getAnomalyIqrMultiplier()).isEqualTo(2.0);
    }

    @Test
    void engineRunsOnThePool() {
        double[] revenue = TestSeriesFactory.gaussian(24, 1000, 100, 123);
        MetricDataset dataset = MetricDataset.of(
                TestSeriesFactory.series("revenue", revenue),
                TestSeriesFactory.series("profit", TestSeriesFactory.affine(revenue, 0.2, -50)),
                TestSeriesFactory.series("visits", TestSeriesFactory.gaussian(24, 300, 20, 456)));

        EngineReport report = correlationEngine.run(dataset, List.of());

        assertThat(report.correlations().pairsEvaluated()).isEqualTo(3);
        assertThat(report.patterns()).hasSize(3);
        assertThat(report.correlations().results()).isNotEmpty();
    }
}
