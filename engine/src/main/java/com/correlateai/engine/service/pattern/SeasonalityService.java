package com.correlateai.engine.service.pattern;

import com.correlateai.engine.config.PatternProperties;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Folds the series into blocks of one candidate period and measures how
 * consistently the within-period positions move together across blocks.
 */
@Service
@RequiredArgsConstructor
public class SeasonalityService {

    private final PatternProperties properties;

    public Seasonality detect(double[] values) {
        if (values.length < properties.getSeasonalityMinPoints()) {
            return Seasonality.NONE;
        }
        Integer bestPeriod = null;
        double bestScore = 0.0;
        for (int period : properties.getCandidatePeriods()) {
            if (period < 2 || values.length < 2 * period) {
                continue;
            }
            double score = seasonalScore(values, period);
            if (score > bestScore) {
                bestScore = score;
                bestPeriod = period;
            }
        }
        if (bestPeriod == null || bestScore <= properties.getSeasonalityThreshold()) {
            return new Seasonality(false, null, bestScore);
        }
        return new Seasonality(true, bestPeriod, bestScore);
    }

    /**
     * Mean absolute correlation between every pair of non-constant positions.
     */
    double seasonalScore(double[] values, int period) {
        int blocks = values.length / period;
        if (blocks < 2) {
            return 0.0;
        }
        double[][] columns = new double[period][blocks];
        for (int b = 0; b < blocks; b++) {
            for (int p = 0; p < period; p++) {
                columns[p][b] = values[b * period + p];
            }
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < period; i++) {
            if (!SeriesMath.hasVariance(columns[i])) {
                continue;
            }
            for (int j = i + 1; j < period; j++) {
                if (!SeriesMath.hasVariance(columns[j])) {
                    continue;
                }
                sum += Math.abs(SeriesMath.pearson(columns[i], columns[j]));
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    public record Seasonality(boolean detected, Integer period, double score) {
        static final Seasonality NONE = new Seasonality(false, null, 0.0);
    }
}
