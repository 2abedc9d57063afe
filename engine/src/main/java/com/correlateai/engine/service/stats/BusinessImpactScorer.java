package com.correlateai.engine.service.stats;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Ranks a relationship on a 0-10 scale from its strength, significance,
 * the business relevance of the metric names and the data quality.
 */
@Component
@RequiredArgsConstructor
public class BusinessImpactScorer {

    private final CorrelationProperties properties;

    public double score(String metric1, String metric2, double strongestCorrelation, double pValue, double quality) {
        double base = Math.abs(strongestCorrelation) * 10.0;
        double score = base
                * significanceMultiplier(pValue)
                * domainMultiplier(metric1, metric2)
                * (0.5 + 0.5 * quality);
        return SeriesMath.clamp(score, 0.0, 10.0);
    }

    public boolean isBusinessCritical(String metric1, String metric2) {
        String first = metric1.toLowerCase(Locale.ROOT);
        String second = metric2.toLowerCase(Locale.ROOT);
        for (String term : properties.getHighImpactTerms()) {
            String keyword = term.toLowerCase(Locale.ROOT);
            if (first.contains(keyword) || second.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    double significanceMultiplier(double pValue) {
        if (pValue < 0.01) {
            return 1.3;
        }
        if (pValue < 0.05) {
            return 1.1;
        }
        return 0.8;
    }

    double domainMultiplier(String metric1, String metric2) {
        return isBusinessCritical(metric1, metric2) ? 1.4 : 1.0;
    }
}
