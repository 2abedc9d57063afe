package com.correlateai.engine.service.stats;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
public class LagCorrelationService {

    private static final int MIN_OVERLAP = 3;

    private final CorrelationProperties properties;

    /**
     * Pearson correlation at each lag. Key {@code +k}: first series leads the second
     * by k samples; key {@code -k}: second series leads the first.
     */
    public Map<Integer, Double> scan(double[] first, double[] second) {
        int n = first.length;
        int maxLag = Math.min(properties.getMaxLag(), n / 2);
        Map<Integer, Double> lags = new TreeMap<>();
        for (int lag = 1; lag <= maxLag; lag++) {
            if (n - lag <= MIN_OVERLAP) {
                break;
            }
            double forward = SeriesMath.pearson(
                    SeriesMath.slice(first, 0, n - lag), SeriesMath.slice(second, lag, n));
            double backward = SeriesMath.pearson(
                    SeriesMath.slice(second, 0, n - lag), SeriesMath.slice(first, lag, n));
            lags.put(lag, forward);
            lags.put(-lag, backward);
        }
        return Collections.unmodifiableMap(lags);
    }

    public static double strongest(Map<Integer, Double> lags) {
        return lags.values().stream().mapToDouble(Math::abs).max().orElse(0.0);
    }
}
