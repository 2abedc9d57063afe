package com.correlateai.engine.service.stats;

import com.correlateai.engine.model.ConfidenceInterval;
import com.correlateai.engine.util.SeriesMath;
import org.springframework.stereotype.Service;

/**
 * 95% interval on a Pearson coefficient via the Fisher z-transform.
 */
@Service
public class ConfidenceIntervalService {

    private static final double Z_95 = 1.96;
    private static final double DEGENERATE = 0.99;
    private static final double DEGENERATE_HALF_WIDTH = 0.01;

    public ConfidenceInterval calculate(double r, int n) {
        if (Math.abs(r) >= DEGENERATE) {
            return new ConfidenceInterval(
                    SeriesMath.clamp(r - DEGENERATE_HALF_WIDTH, -1.0, 1.0),
                    SeriesMath.clamp(r + DEGENERATE_HALF_WIDTH, -1.0, 1.0));
        }
        if (n <= 3) {
            return new ConfidenceInterval(-1.0, 1.0);
        }
        double z = 0.5 * Math.log((1 + r) / (1 - r));
        double margin = Z_95 / Math.sqrt(n - 3.0);
        return new ConfidenceInterval(Math.tanh(z - margin), Math.tanh(z + margin));
    }
}
