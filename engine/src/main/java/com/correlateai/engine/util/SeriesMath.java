package com.correlateai.engine.util;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

public final class SeriesMath {

    private SeriesMath() {
    }

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        return StatUtils.mean(values);
    }

    public static double populationVariance(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        return StatUtils.populationVariance(values);
    }

    public static double populationStd(double[] values) {
        return Math.sqrt(populationVariance(values));
    }

    public static boolean hasVariance(double[] values) {
        return populationVariance(values) > 0.0;
    }

    /**
     * Percentile with linear interpolation between closest ranks, {@code p} in (0, 100].
     */
    public static double percentile(double[] values, double p) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(values, p);
    }

    /**
     * Pearson coefficient clamped into [-1, 1]; 0 when undefined (too short or constant input).
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2 || !hasVariance(x) || !hasVariance(y)) {
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return Double.isFinite(r) ? clamp(r, -1.0, 1.0) : 0.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double[] slice(double[] values, int from, int to) {
        return Arrays.copyOfRange(values, from, to);
    }

    public static double[] tail(double[] values, int count) {
        return Arrays.copyOfRange(values, Math.max(0, values.length - count), values.length);
    }
}
