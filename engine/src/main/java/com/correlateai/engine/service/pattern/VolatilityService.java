package com.correlateai.engine.service.pattern;

import com.correlateai.engine.util.SeriesMath;
import org.springframework.stereotype.Service;

import java.util.Arrays;

@Service
public class VolatilityService {

    private static final double SCALE = 10.0;

    /**
     * Standard deviation of period-over-period relative change, scaled into [0, 1].
     * Steps from a zero value are left out.
     */
    public double score(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double[] changes = new double[values.length - 1];
        int count = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1] != 0) {
                changes[count++] = (values[i] - values[i - 1]) / values[i - 1];
            }
        }
        if (count == 0) {
            return 0.0;
        }
        double std = SeriesMath.populationStd(Arrays.copyOf(changes, count));
        return SeriesMath.clamp(std * SCALE, 0.0, 1.0);
    }
}
