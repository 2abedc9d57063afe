package com.correlateai.engine.service.stats;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Fits a tree ensemble predicting the second series from engineered features
 * of the first, reporting mean feature importance and in-sample R².
 */
@Service
@RequiredArgsConstructor
public class NonlinearFitService {

    static final int MIN_ROWS = 5;

    private final CorrelationProperties properties;
    private final LagFeatureBuilder featureBuilder;

    public FitResult fit(double[] predictor, double[] target) {
        int n = Math.min(predictor.length, target.length);
        if (n < MIN_ROWS) {
            return FitResult.NONE;
        }
        double[][] x = featureBuilder.build(SeriesMath.slice(predictor, 0, n));
        double[] y = SeriesMath.slice(target, 0, n);

        CorrelationProperties.Forest config = properties.getForest();
        RegressionForest forest = new RegressionForest(
                config.getTrees(), config.getMaxDepth(), config.getMinSamplesLeaf(), config.getSeed())
                .fit(x, y);

        double importance = Arrays.stream(forest.featureImportances()).average().orElse(0.0);
        double r2 = rSquared(forest, x, y);
        return new FitResult(SeriesMath.clamp(importance, 0.0, 1.0), SeriesMath.clamp(r2, 0.0, 1.0));
    }

    private double rSquared(RegressionForest forest, double[][] x, double[] y) {
        double mean = SeriesMath.mean(y);
        double residual = 0.0;
        double total = 0.0;
        for (int i = 0; i < y.length; i++) {
            double error = y[i] - forest.predict(x[i]);
            residual += error * error;
            total += (y[i] - mean) * (y[i] - mean);
        }
        if (total <= 0) {
            return 0.0;
        }
        double r2 = 1.0 - residual / total;
        return Double.isFinite(r2) ? r2 : 0.0;
    }

    public record FitResult(double featureImportance, double explainedVariance) {
        public static final FitResult NONE = new FitResult(0.0, 0.0);
    }
}
