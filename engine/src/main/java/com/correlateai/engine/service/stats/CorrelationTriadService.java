package com.correlateai.engine.service.stats;

import com.correlateai.engine.util.SeriesMath;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.correlation.KendallsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Linear, rank-monotonic and rank-concordance coefficients with two-sided p-values.
 * Undefined coefficients come back as 0 with p-value 1.
 */
@Slf4j
@Service
public class CorrelationTriadService {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    public Triad calculate(double[] first, double[] second) {
        int n = first.length;
        double pearson = SeriesMath.pearson(first, second);
        double spearman = spearman(first, second);
        double kendall = kendall(first, second);
        return new Triad(
                pearson, tTestPValue(pearson, n),
                spearman, tTestPValue(spearman, n),
                kendall, kendallPValue(kendall, first, second)
        );
    }

    private double spearman(double[] first, double[] second) {
        if (!SeriesMath.hasVariance(first) || !SeriesMath.hasVariance(second)) {
            return 0.0;
        }
        try {
            return finiteOrZero(new SpearmansCorrelation().correlation(first, second));
        } catch (MathIllegalArgumentException ex) {
            log.debug("Spearman correlation undefined: {}", ex.getMessage());
            return 0.0;
        }
    }

    private double kendall(double[] first, double[] second) {
        if (!SeriesMath.hasVariance(first) || !SeriesMath.hasVariance(second)) {
            return 0.0;
        }
        try {
            return finiteOrZero(new KendallsCorrelation().correlation(first, second));
        } catch (MathIllegalArgumentException ex) {
            log.debug("Kendall correlation undefined: {}", ex.getMessage());
            return 0.0;
        }
    }

    /**
     * p-value of H0: rho = 0 using the t statistic with n - 2 degrees of freedom.
     */
    double tTestPValue(double r, int n) {
        if (n < 3 || r == 0.0) {
            return 1.0;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double t = r * Math.sqrt((n - 2) / (1.0 - r * r));
        TDistribution distribution = new TDistribution(n - 2);
        return SeriesMath.clamp(2.0 * (1.0 - distribution.cumulativeProbability(Math.abs(t))), 0.0, 1.0);
    }

    /**
     * Normal approximation of the tau-b statistic with the tie-corrected variance.
     */
    double kendallPValue(double tau, double[] first, double[] second) {
        int n = first.length;
        if (n < 3 || tau == 0.0) {
            return 1.0;
        }
        TieCounts xTies = TieCounts.of(first);
        TieCounts yTies = TieCounts.of(second);
        double totalPairs = n * (n - 1) / 2.0;
        double s = tau * Math.sqrt(totalPairs - xTies.pairs()) * Math.sqrt(totalPairs - yTies.pairs());
        double m = n * (n - 1.0);
        double variance = (m * (2.0 * n + 5) - xTies.weightedSum() - yTies.weightedSum()) / 18.0
                + (2.0 * xTies.pairs() * yTies.pairs()) / m
                + xTies.tripleSum() * yTies.tripleSum() / (9.0 * m * (n - 2));
        if (variance <= 0) {
            return 1.0;
        }
        double z = s / Math.sqrt(variance);
        return SeriesMath.clamp(2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z))), 0.0, 1.0);
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? SeriesMath.clamp(value, -1.0, 1.0) : 0.0;
    }

    private record TieCounts(double pairs, double tripleSum, double weightedSum) {

        static TieCounts of(double[] values) {
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            double pairs = 0;
            double tripleSum = 0;
            double weightedSum = 0;
            int i = 0;
            while (i < sorted.length) {
                int j = i + 1;
                while (j < sorted.length && sorted[j] == sorted[i]) {
                    j++;
                }
                double t = j - i;
                if (t > 1) {
                    pairs += t * (t - 1) / 2.0;
                    tripleSum += t * (t - 1) * (t - 2);
                    weightedSum += t * (t - 1) * (2 * t + 5);
                }
                i = j;
            }
            return new TieCounts(pairs, tripleSum, weightedSum);
        }
    }

    public record Triad(
            double pearson,
            double pearsonPValue,
            double spearman,
            double spearmanPValue,
            double kendall,
            double kendallPValue
    ) {
        public double strongest() {
            return Math.max(Math.abs(pearson), Math.max(Math.abs(spearman), Math.abs(kendall)));
        }

        public double combinedPValue() {
            return Math.min(pearsonPValue, Math.min(spearmanPValue, kendallPValue));
        }
    }
}
