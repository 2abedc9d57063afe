package com.correlateai.engine.service.stats;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the first estimator, in priority order, that supports the input.
 */
@Slf4j
@Service
public class MutualInformationService {

    private final List<MutualInformationEstimator> estimators;

    public MutualInformationService(List<MutualInformationEstimator> estimators) {
        this.estimators = List.copyOf(estimators);
    }

    public double calculate(double[] first, double[] second) {
        for (MutualInformationEstimator estimator : estimators) {
            if (estimator.supports(first, second)) {
                return estimator.estimate(first, second);
            }
            log.debug("{} does not support input of size {}, trying next estimator",
                    estimator.getClass().getSimpleName(), first.length);
        }
        return 0.0;
    }
}
