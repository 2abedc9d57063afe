package com.correlateai.engine.service.stats;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.special.Gamma;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Kraskov-Stögbauer-Grassberger k-nearest-neighbour estimator (algorithm 1)
 * over scaled inputs with the max-norm in the joint space.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class KsgMutualInformationEstimator implements MutualInformationEstimator {

    private final CorrelationProperties properties;

    @Override
    public boolean supports(double[] first, double[] second) {
        int k = properties.getMutualInformation().getNeighbors();
        return first.length == second.length
                && first.length > k
                && SeriesMath.hasVariance(first)
                && SeriesMath.hasVariance(second);
    }

    @Override
    public double estimate(double[] first, double[] second) {
        int n = first.length;
        int k = properties.getMutualInformation().getNeighbors();
        double[] x = scale(first);
        double[] y = scale(second);

        double marginalDigammaSum = 0.0;
        double[] joint = new double[n - 1];
        for (int i = 0; i < n; i++) {
            int idx = 0;
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    joint[idx++] = Math.max(Math.abs(x[i] - x[j]), Math.abs(y[i] - y[j]));
                }
            }
            double[] sorted = joint.clone();
            Arrays.sort(sorted);
            double radius = sorted[k - 1];

            int nx = 0;
            int ny = 0;
            for (int j = 0; j < n; j++) {
                if (j == i) {
                    continue;
                }
                if (Math.abs(x[i] - x[j]) < radius) {
                    nx++;
                }
                if (Math.abs(y[i] - y[j]) < radius) {
                    ny++;
                }
            }
            marginalDigammaSum += Gamma.digamma(nx + 1) + Gamma.digamma(ny + 1);
        }

        double mi = Gamma.digamma(n) + Gamma.digamma(k) - marginalDigammaSum / n;
        return Double.isFinite(mi) ? Math.max(0.0, mi) : 0.0;
    }

    private double[] scale(double[] values) {
        double std = SeriesMath.populationStd(values);
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] / std;
        }
        return scaled;
    }
}
