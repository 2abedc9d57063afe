package com.correlateai.engine.service.stats;

import com.correlateai.engine.config.CorrelationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

/**
 * Simplified Granger test of "first helps predict second": compares the residuals
 * of an autoregression of the second series with and without lags of the first.
 * The F statistic is mapped to {@code max(0.001, 1 / (1 + F))}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrangerCausalityService {

    static final int MIN_SAMPLES = 10;
    static final double NO_EVIDENCE = 1.0;
    static final double P_VALUE_FLOOR = 0.001;

    private final CorrelationProperties properties;

    public double pValue(double[] cause, double[] effect) {
        int n = effect.length;
        if (n < MIN_SAMPLES || cause.length != n) {
            return NO_EVIDENCE;
        }
        int lags = Math.min(properties.getMaxGrangerLags(), n / 3);
        // shrink the lag order until the full model keeps at least one residual degree of freedom
        while (lags > 1 && residualDegreesOfFreedom(n, lags) < 1) {
            lags--;
        }
        if (lags < 1 || residualDegreesOfFreedom(n, lags) < 1) {
            return NO_EVIDENCE;
        }

        int rows = n - lags;
        double[] y = new double[rows];
        double[][] restricted = new double[rows][lags];
        double[][] full = new double[rows][2 * lags];
        for (int r = 0; r < rows; r++) {
            int t = r + lags;
            y[r] = effect[t];
            for (int l = 1; l <= lags; l++) {
                restricted[r][l - 1] = effect[t - l];
                full[r][l - 1] = effect[t - l];
                full[r][lags + l - 1] = cause[t - l];
            }
        }

        try {
            double rssRestricted = residualSumOfSquares(y, restricted);
            double rssFull = residualSumOfSquares(y, full);
            if (!(rssFull > 0) || !Double.isFinite(rssRestricted)) {
                return NO_EVIDENCE;
            }
            double f = ((rssRestricted - rssFull) / lags) / (rssFull / residualDegreesOfFreedom(n, lags));
            if (!Double.isFinite(f)) {
                return NO_EVIDENCE;
            }
            f = Math.max(0.0, f);
            return Math.max(P_VALUE_FLOOR, 1.0 / (1.0 + f));
        } catch (SingularMatrixException ex) {
            log.debug("Granger regression singular with {} lags over {} rows", lags, rows);
            return NO_EVIDENCE;
        } catch (MathIllegalArgumentException ex) {
            log.debug("Granger regression rejected input: {}", ex.getMessage());
            return NO_EVIDENCE;
        }
    }

    private static int residualDegreesOfFreedom(int n, int lags) {
        return (n - lags) - 2 * lags - 1;
    }

    private static double residualSumOfSquares(double[] y, double[][] x) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(y, x);
        return regression.calculateResidualSumOfSquares();
    }
}
