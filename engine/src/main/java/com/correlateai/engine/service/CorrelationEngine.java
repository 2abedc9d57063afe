package com.correlateai.engine.service;

import com.correlateai.engine.exception.AnalysisException;
import com.correlateai.engine.model.CorrelationAnalysisReport;
import com.correlateai.engine.model.EngineReport;
import com.correlateai.engine.model.MetricDataset;
import com.correlateai.engine.model.SeriesPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for callers holding a dataset: runs the pairwise and per-series
 * analyses side by side and bundles their output with a summary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationEngine {

    private final PairwiseCorrelationAnalyzer pairwiseCorrelationAnalyzer;
    private final SeriesPatternAnalyzer seriesPatternAnalyzer;
    private final CorrelationSummaryService correlationSummaryService;

    public EngineReport run(MetricDataset dataset, List<String> metricNames) {
        if (dataset == null) {
            throw new AnalysisException("Dataset must not be null");
        }
        log.info("Analyzing {} metrics", metricNames == null || metricNames.isEmpty() ? dataset.size() : metricNames.size());

        try {
            CompletableFuture<CorrelationAnalysisReport> correlations =
                    pairwiseCorrelationAnalyzer.analyzeAsync(dataset, metricNames);
            CompletableFuture<List<SeriesPattern>> patterns =
                    seriesPatternAnalyzer.analyzeAsync(dataset, metricNames);

            CorrelationAnalysisReport report = correlations.join();
            List<SeriesPattern> seriesPatterns = patterns.join();
            return new EngineReport(report, seriesPatterns, correlationSummaryService.summarize(report.results()));
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof AnalysisException analysisException) {
                throw analysisException;
            }
            throw new AnalysisException("Analysis failed", ex.getCause());
        } catch (AnalysisException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new AnalysisException("Analysis failed", ex);
        }
    }
}
