package com.correlateai.engine.service.stats;

/**
 * One way of estimating the mutual information between two aligned series.
 */
public interface MutualInformationEstimator {

    /**
     * Whether this estimator produces a meaningful value for the given input.
     */
    boolean supports(double[] first, double[] second);

    /**
     * Mutual information in nats, never negative.
     */
    double estimate(double[] first, double[] second);
}
