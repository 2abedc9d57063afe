package com.correlateai.engine.service;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.exception.AnalysisException;
import com.correlateai.engine.model.AlignedPair;
import com.correlateai.engine.model.ConfidenceInterval;
import com.correlateai.engine.model.CorrelationAnalysisReport;
import com.correlateai.engine.model.CorrelationResult;
import com.correlateai.engine.model.MetricDataset;
import com.correlateai.engine.model.RelationshipType;
import com.correlateai.engine.service.stats.BusinessImpactScorer;
import com.correlateai.engine.service.stats.ConfidenceIntervalService;
import com.correlateai.engine.service.stats.CorrelationTriadService;
import com.correlateai.engine.service.stats.DataQualityService;
import com.correlateai.engine.service.stats.GrangerCausalityService;
import com.correlateai.engine.service.stats.LagCorrelationService;
import com.correlateai.engine.service.stats.MutualInformationService;
import com.correlateai.engine.service.stats.NonlinearFitService;
import com.correlateai.engine.service.stats.RelationshipClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs the full measurement pipeline over every unordered pair of metrics and
 * ranks the surviving pairs by business impact. Pairs that are too short or
 * fail the quality gate are left out of the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PairwiseCorrelationAnalyzer {

    private static final Comparator<CorrelationResult> BY_IMPACT =
            Comparator.comparingDouble(CorrelationResult::getBusinessImpactScore).reversed()
                    .thenComparing(CorrelationResult::getMetric1)
                    .thenComparing(CorrelationResult::getMetric2);

    private final CorrelationProperties properties;
    private final DataQualityService dataQualityService;
    private final CorrelationTriadService triadService;
    private final MutualInformationService mutualInformationService;
    private final LagCorrelationService lagCorrelationService;
    private final GrangerCausalityService grangerCausalityService;
    private final NonlinearFitService nonlinearFitService;
    private final RelationshipClassifier relationshipClassifier;
    private final ConfidenceIntervalService confidenceIntervalService;
    private final BusinessImpactScorer businessImpactScorer;
    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    public List<CorrelationResult> analyze(MetricDataset dataset, List<String> metricNames) {
        return analyzeWithDiagnostics(dataset, metricNames).results();
    }

    public CorrelationAnalysisReport analyzeWithDiagnostics(MetricDataset dataset, List<String> metricNames) {
        return analyzeAsync(dataset, metricNames).join();
    }

    /**
     * Dispatches every pair to the analysis executor without blocking the caller.
     */
    public CompletableFuture<CorrelationAnalysisReport> analyzeAsync(MetricDataset dataset, List<String> metricNames) {
        if (dataset == null) {
            throw new AnalysisException("Dataset must not be null");
        }
        List<String> names = dataset.resolve(metricNames);

        List<CompletableFuture<PairOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                String first = names.get(i);
                String second = names.get(j);
                futures.add(submit(() -> analyzePair(dataset.align(first, second)))
                        .exceptionally(ex -> {
                            log.warn("Pair {} / {} failed and was skipped", first, second, ex);
                            return PairOutcome.failed();
                        }));
            }
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> merge(futures));
    }

    /**
     * Runs the task on the calling thread when the executor refuses it, so a
     * saturated or stopped pool never drops a pair.
     */
    private CompletableFuture<PairOutcome> submit(Supplier<PairOutcome> task) {
        try {
            return CompletableFuture.supplyAsync(task, analysisExecutor);
        } catch (RejectedExecutionException ex) {
            log.debug("Analysis executor rejected pair task, running inline: {}", ex.getMessage());
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException taskFailure) {
                return CompletableFuture.failedFuture(taskFailure);
            }
        }
    }

    private CorrelationAnalysisReport merge(List<CompletableFuture<PairOutcome>> futures) {
        List<CorrelationResult> results = new ArrayList<>();
        int insufficient = 0;
        int lowQuality = 0;
        int failed = 0;
        for (CompletableFuture<PairOutcome> future : futures) {
            PairOutcome outcome = future.join();
            switch (outcome.status()) {
                case REPORTED -> results.add(outcome.result());
                case INSUFFICIENT_DATA -> insufficient++;
                case LOW_QUALITY -> lowQuality++;
                case FAILED -> failed++;
            }
        }
        results.sort(BY_IMPACT);

        log.info("Correlation analysis: {} pairs evaluated, {} reported, {} insufficient data, {} below quality gate, {} failed",
                futures.size(), results.size(), insufficient, lowQuality, failed);
        return new CorrelationAnalysisReport(List.copyOf(results), futures.size(), insufficient, lowQuality, failed);
    }

    PairOutcome analyzePair(AlignedPair pair) {
        int n = pair.size();
        if (n < properties.getMinDataPoints()) {
            log.debug("Skipping {} / {}: {} aligned points, need {}",
                    pair.firstName(), pair.secondName(), n, properties.getMinDataPoints());
            return PairOutcome.insufficientData();
        }
        double[] a = pair.first();
        double[] b = pair.second();

        double quality = dataQualityService.assess(a, b);
        if (quality < properties.getMinQualityScore()) {
            log.debug("Skipping {} / {}: quality {} below {}",
                    pair.firstName(), pair.secondName(), quality, properties.getMinQualityScore());
            return PairOutcome.lowQuality();
        }

        CorrelationTriadService.Triad triad = triadService.calculate(a, b);
        double mutualInformation = mutualInformationService.calculate(a, b);
        Map<Integer, Double> lags = lagCorrelationService.scan(a, b);
        double grangerP = grangerCausalityService.pValue(a, b);
        NonlinearFitService.FitResult fit = nonlinearFitService.fit(a, b);

        double significance = triad.combinedPValue();
        RelationshipType type = relationshipClassifier.classify(
                triad.pearson(), triad.spearman(), lags, mutualInformation);
        ConfidenceInterval interval = confidenceIntervalService.calculate(triad.pearson(), n);
        double impact = businessImpactScorer.score(
                pair.firstName(), pair.secondName(), triad.strongest(), significance, quality);

        CorrelationResult result = CorrelationResult.builder()
                .metric1(pair.firstName())
                .metric2(pair.secondName())
                .sampleSize(n)
                .pearsonCorrelation(triad.pearson())
                .spearmanCorrelation(triad.spearman())
                .kendallCorrelation(triad.kendall())
                .mutualInformation(mutualInformation)
                .grangerCausalityPValue(grangerP)
                .lagCorrelation(lags)
                .mlFeatureImportance(fit.featureImportance())
                .explainedVariance(fit.explainedVariance())
                .statisticalSignificance(significance)
                .businessImpactScore(impact)
                .correlationType(type)
                .confidenceInterval(interval)
                .dataQualityScore(quality)
                .confidenceLevel(relationshipClassifier.confidence(triad.pearson(), significance))
                .build();
        return PairOutcome.reported(result);
    }

    enum PairStatus {
        REPORTED,
        INSUFFICIENT_DATA,
        LOW_QUALITY,
        FAILED
    }

    record PairOutcome(PairStatus status, CorrelationResult result) {

        static PairOutcome reported(CorrelationResult result) {
            return new PairOutcome(PairStatus.REPORTED, result);
        }

        static PairOutcome insufficientData() {
            return new PairOutcome(PairStatus.INSUFFICIENT_DATA, null);
        }

        static PairOutcome lowQuality() {
            return new PairOutcome(PairStatus.LOW_QUALITY, null);
        }

        static PairOutcome failed() {
            return new PairOutcome(PairStatus.FAILED, null);
        }
    }
}
