package com.correlateai.engine.service;

import com.correlateai.engine.config.PatternProperties;
import com.correlateai.engine.exception.AnalysisException;
import com.correlateai.engine.model.MetricDataset;
import com.correlateai.engine.model.MetricSeries;
import com.correlateai.engine.model.SeriesPattern;
import com.correlateai.engine.service.pattern.AnomalyService;
import com.correlateai.engine.service.pattern.SeasonalityService;
import com.correlateai.engine.service.pattern.TrendService;
import com.correlateai.engine.service.pattern.VolatilityService;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class SeriesPatternAnalyzer {

    private static final double LENGTH_WEIGHT = 0.4;
    private static final double TREND_WEIGHT = 0.4;
    private static final double STABILITY_WEIGHT = 0.2;
    private static final double FULL_CONFIDENCE_LENGTH = 24.0;

    private final PatternProperties properties;
    private final TrendService trendService;
    private final SeasonalityService seasonalityService;
    private final VolatilityService volatilityService;
    private final AnomalyService anomalyService;
    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    /**
     * One pattern per metric, in the order requested; metrics shorter than the
     * minimum length are left out.
     */
    public List<SeriesPattern> analyze(MetricDataset dataset, List<String> metricNames) {
        return analyzeAsync(dataset, metricNames).join();
    }

    public CompletableFuture<List<SeriesPattern>> analyzeAsync(MetricDataset dataset, List<String> metricNames) {
        if (dataset == null) {
            throw new AnalysisException("Dataset must not be null");
        }
        List<String> names = dataset.resolve(metricNames);

        List<CompletableFuture<Optional<SeriesPattern>>> futures = names.stream()
                .map(name -> submit(() -> analyzeSeries(dataset.require(name)))
                        .exceptionally(ex -> {
                            log.warn("Pattern analysis failed for {}", name, ex);
                            return Optional.empty();
                        }))
                .toList();
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<SeriesPattern> patterns = futures.stream()
                            .map(CompletableFuture::join)
                            .flatMap(Optional::stream)
                            .toList();
                    log.info("Pattern analysis: {} of {} metrics analyzed", patterns.size(), names.size());
                    return patterns;
                });
    }

    private CompletableFuture<Optional<SeriesPattern>> submit(Supplier<Optional<SeriesPattern>> task) {
        try {
            return CompletableFuture.supplyAsync(task, analysisExecutor);
        } catch (RejectedExecutionException ex) {
            log.debug("Analysis executor rejected series task, running inline: {}", ex.getMessage());
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException taskFailure) {
                return CompletableFuture.failedFuture(taskFailure);
            }
        }
    }

    Optional<SeriesPattern> analyzeSeries(MetricSeries series) {
        if (series.size() < properties.getMinPeriods()) {
            log.debug("Skipping pattern analysis for {}: {} points, need {}",
                    series.name(), series.size(), properties.getMinPeriods());
            return Optional.empty();
        }
        double[] values = series.values();
        List<LocalDateTime> timestamps = series.timestamps();

        TrendService.Trend trend = trendService.trend(values);
        SeasonalityService.Seasonality seasonality = seasonalityService.detect(values);
        double volatility = volatilityService.score(values);

        return Optional.of(SeriesPattern.builder()
                .metricName(series.name())
                .trendDirection(trend.direction())
                .trendStrength(trend.strength())
                .seasonalityDetected(seasonality.detected())
                .seasonalPeriod(seasonality.detected() ? seasonality.period() : null)
                .volatilityScore(volatility)
                .anomalyPeriods(anomalyService.anomalies(timestamps, values))
                .changePoints(anomalyService.changePoints(timestamps, values))
                .forecastDirection(trendService.forecastDirection(values))
                .confidenceLevel(confidence(values.length, trend.strength(), volatility))
                .build());
    }

    double confidence(int length, double trendStrength, double volatility) {
        double lengthAdequacy = Math.min(1.0, length / FULL_CONFIDENCE_LENGTH);
        double stability = Math.max(0.0, 1.0 - volatility);
        double confidence = lengthAdequacy * LENGTH_WEIGHT + trendStrength * TREND_WEIGHT + stability * STABILITY_WEIGHT;
        return SeriesMath.clamp(confidence, 0.0, 1.0);
    }
}
