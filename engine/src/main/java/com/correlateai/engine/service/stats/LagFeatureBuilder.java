package com.correlateai.engine.service.stats;

import org.springframework.stereotype.Component;

/**
 * Builds the predictor matrix used by the nonlinear fit: rolling means over
 * 3 and 5 samples, the first difference, and copies lagged by 1 and 2 samples.
 * Every column has the input's length; warm-up gaps are back-filled or padded
 * with the leading values.
 */
@Component
public class LagFeatureBuilder {

    static final int[] ROLLING_WINDOWS = {3, 5};
    static final int[] LAGS = {1, 2};

    public double[][] build(double[] values) {
        int n = values.length;
        int columns = ROLLING_WINDOWS.length + 1 + LAGS.length;
        double[][] rows = new double[n][columns];

        int column = 0;
        for (int window : ROLLING_WINDOWS) {
            double[] mean = rollingMean(values, window);
            for (int i = 0; i < n; i++) {
                rows[i][column] = mean[i];
            }
            column++;
        }

        for (int i = 0; i < n; i++) {
            rows[i][column] = i == 0 ? 0.0 : values[i] - values[i - 1];
        }
        column++;

        for (int lag : LAGS) {
            for (int i = 0; i < n; i++) {
                rows[i][column] = i < lag ? values[i] : values[i - lag];
            }
            column++;
        }
        return rows;
    }

    private double[] rollingMean(double[] values, int window) {
        int n = values.length;
        double[] out = new double[n];
        if (n < window) {
            System.arraycopy(values, 0, out, 0, n);
            return out;
        }
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            if (i >= window - 1) {
                out[i] = sum / window;
            }
        }
        for (int i = 0; i < window - 1; i++) {
            out[i] = out[window - 1];
        }
        return out;
    }
}
