package com.correlateai.engine.service.stats;

import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Scores how trustworthy a pair of aligned series is for correlation analysis.
 * The result is in [0, 1]; a constant series always scores 0.
 */
@Service
@RequiredArgsConstructor
public class DataQualityService {

    static final double VARIANCE_WEIGHT = 0.4;
    static final double OUTLIER_WEIGHT = 0.3;
    static final double NORMALITY_WEIGHT = 0.3;
    private static final double OUTLIER_IQR_MULTIPLIER = 1.5;

    private final NormalityTest normalityTest;

    public double assess(double[] first, double[] second) {
        if (!SeriesMath.hasVariance(first) || !SeriesMath.hasVariance(second)) {
            return 0.0;
        }
        double outlierScore = (outlierScore(first) + outlierScore(second)) / 2.0;
        double normalityScore = (normalityScore(first) + normalityScore(second)) / 2.0;
        double quality = VARIANCE_WEIGHT + outlierScore * OUTLIER_WEIGHT + normalityScore * NORMALITY_WEIGHT;
        return SeriesMath.clamp(quality, 0.0, 1.0);
    }

    double outlierScore(double[] values) {
        double q1 = SeriesMath.percentile(values, 25);
        double q3 = SeriesMath.percentile(values, 75);
        double iqr = q3 - q1;
        if (iqr == 0) {
            return 0.5;
        }
        double lower = q1 - OUTLIER_IQR_MULTIPLIER * iqr;
        double upper = q3 + OUTLIER_IQR_MULTIPLIER * iqr;
        int outliers = 0;
        for (double v : values) {
            if (v < lower || v > upper) {
                outliers++;
            }
        }
        double ratio = outliers / (double) values.length;
        return Math.max(0.0, 1.0 - ratio * 2.0);
    }

    double normalityScore(double[] values) {
        return Math.min(1.0, normalityTest.pValue(values) * 10.0);
    }
}
