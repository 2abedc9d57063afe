package com.correlateai.engine.service.stats;

import com.correlateai.engine.util.SeriesMath;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Closed form for a bivariate Gaussian: {@code -0.5 * ln(1 - r²)} on the Pearson
 * coefficient, pinned to 1.0 once |r| reaches 0.99. Accepts any input.
 */
@Component
@Order(2)
public class LinearMutualInformationEstimator implements MutualInformationEstimator {

    static final double SATURATION = 0.99;

    @Override
    public boolean supports(double[] first, double[] second) {
        return true;
    }

    @Override
    public double estimate(double[] first, double[] second) {
        return fromCorrelation(SeriesMath.pearson(first, second));
    }

    public double fromCorrelation(double r) {
        if (Math.abs(r) >= SATURATION) {
            return 1.0;
        }
        return Math.max(0.0, -0.5 * Math.log(1.0 - r * r));
    }
}
