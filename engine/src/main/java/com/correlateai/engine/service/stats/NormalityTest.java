package com.correlateai.engine.service.stats;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.springframework.stereotype.Component;

/**
 * D'Agostino-Pearson K² omnibus test: combines the skewness and kurtosis
 * z-scores into a chi-squared statistic with two degrees of freedom.
 */
@Component
public class NormalityTest {

    public static final int MIN_SAMPLES = 9;

    private static final ChiSquaredDistribution CHI_SQUARED_2 = new ChiSquaredDistribution(2);

    /**
     * Returns the p-value of the normality hypothesis, or 1.0 when the sample is
     * too short or degenerate to be tested.
     */
    public double pValue(double[] values) {
        int n = values.length;
        if (n < MIN_SAMPLES) {
            return 1.0;
        }
        Moments moments = Moments.of(values);
        if (moments.m2() <= 0) {
            return 1.0;
        }
        double zSkew = skewZ(moments.skewness(), n);
        double zKurt = kurtosisZ(moments.kurtosis(), n);
        double k2 = zSkew * zSkew + zKurt * zKurt;
        if (!Double.isFinite(k2)) {
            return 1.0;
        }
        return 1.0 - CHI_SQUARED_2.cumulativeProbability(k2);
    }

    private double skewZ(double b1, double n) {
        double y = b1 * Math.sqrt(((n + 1) * (n + 3)) / (6.0 * (n - 2)));
        double beta2 = (3.0 * (n * n + 27 * n - 70) * (n + 1) * (n + 3))
                / ((n - 2.0) * (n + 5) * (n + 7) * (n + 9));
        double w2 = -1 + Math.sqrt(2 * (beta2 - 1));
        double delta = 1 / Math.sqrt(0.5 * Math.log(w2));
        double alpha = Math.sqrt(2.0 / (w2 - 1));
        if (y == 0) {
            y = 1;
        }
        double ratio = y / alpha;
        return delta * Math.log(ratio + Math.sqrt(ratio * ratio + 1));
    }

    private double kurtosisZ(double b2, double n) {
        double expected = 3.0 * (n - 1) / (n + 1);
        double varB2 = 24.0 * n * (n - 2) * (n - 3) / ((n + 1) * (n + 1) * (n + 3) * (n + 5));
        double x = (b2 - expected) / Math.sqrt(varB2);
        double sqrtBeta1 = 6.0 * (n * n - 5 * n + 2) / ((n + 7) * (n + 9))
                * Math.sqrt((6.0 * (n + 3) * (n + 5)) / (n * (n - 2) * (n - 3)));
        double a = 6.0 + 8.0 / sqrtBeta1 * (2.0 / sqrtBeta1 + Math.sqrt(1 + 4.0 / (sqrtBeta1 * sqrtBeta1)));
        double term1 = 1 - 2 / (9.0 * a);
        double denom = 1 + x * Math.sqrt(2 / (a - 4.0));
        if (denom == 0.0) {
            return Double.NaN;
        }
        double term2 = Math.signum(denom) * Math.cbrt((1 - 2.0 / a) / Math.abs(denom));
        return (term1 - term2) / Math.sqrt(2 / (9.0 * a));
    }

    private record Moments(double m2, double m3, double m4) {

        static Moments of(double[] values) {
            double mean = 0;
            for (double v : values) {
                mean += v;
            }
            mean /= values.length;
            double m2 = 0;
            double m3 = 0;
            double m4 = 0;
            for (double v : values) {
                double d = v - mean;
                double d2 = d * d;
                m2 += d2;
                m3 += d2 * d;
                m4 += d2 * d2;
            }
            return new Moments(m2 / values.length, m3 / values.length, m4 / values.length);
        }

        double skewness() {
            return m3 / Math.pow(m2, 1.5);
        }

        double kurtosis() {
            return m4 / (m2 * m2);
        }
    }
}
