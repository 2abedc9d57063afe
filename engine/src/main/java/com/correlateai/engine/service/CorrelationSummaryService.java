package com.correlateai.engine.service;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.model.AnalysisSummary;
import com.correlateai.engine.model.CorrelationResult;
import com.correlateai.engine.model.RelationshipType;
import com.correlateai.engine.service.stats.BusinessImpactScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Headline numbers over a set of ranked correlation results.
 */
@Service
@RequiredArgsConstructor
public class CorrelationSummaryService {

    private final CorrelationProperties properties;
    private final BusinessImpactScorer businessImpactScorer;

    public AnalysisSummary summarize(List<CorrelationResult> results) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (RelationshipType type : RelationshipType.values()) {
            byType.put(type.getLabel(), 0);
        }
        results.forEach(result -> byType.merge(result.getCorrelationType().getLabel(), 1, Integer::sum));

        int highImpact = (int) results.stream()
                .filter(result -> result.getBusinessImpactScore() >= properties.getHighImpactThreshold())
                .count();
        int businessMetrics = (int) results.stream()
                .filter(result -> businessImpactScorer.isBusinessCritical(result.getMetric1(), result.getMetric2()))
                .count();
        double averageImpact = results.stream()
                .mapToDouble(CorrelationResult::getBusinessImpactScore)
                .average()
                .orElse(0.0);
        List<CorrelationResult> keyFindings = results.stream()
                .sorted(Comparator.comparingDouble(CorrelationResult::getBusinessImpactScore).reversed())
                .limit(properties.getSummaryTopN())
                .toList();

        return AnalysisSummary.builder()
                .totalCorrelations(results.size())
                .highImpactFindings(highImpact)
                .businessMetricFindings(businessMetrics)
                .averageImpactScore(averageImpact)
                .byType(byType)
                .keyFindings(keyFindings)
                .build();
    }
}
