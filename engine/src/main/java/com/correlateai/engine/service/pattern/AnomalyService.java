package com.correlateai.engine.service.pattern;

import com.correlateai.engine.config.PatternProperties;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AnomalyService {

    private static final int MIN_CHANGE_POINT_SAMPLES = 6;

    private final PatternProperties properties;

    /**
     * Timestamps of values outside the widened interquartile fence.
     */
    public List<LocalDateTime> anomalies(List<LocalDateTime> timestamps, double[] values) {
        double q1 = SeriesMath.percentile(values, 25);
        double q3 = SeriesMath.percentile(values, 75);
        double fence = properties.getAnomalyIqrMultiplier() * (q3 - q1);
        double lower = q1 - fence;
        double upper = q3 + fence;

        List<LocalDateTime> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < lower || values[i] > upper) {
                anomalies.add(timestamps.get(i));
            }
        }
        return List.copyOf(anomalies);
    }

    /**
     * Timestamps where the mean of the following window departs from the mean of
     * the preceding window by more than the configured relative threshold.
     */
    public List<LocalDateTime> changePoints(List<LocalDateTime> timestamps, double[] values) {
        int n = values.length;
        if (n < MIN_CHANGE_POINT_SAMPLES) {
            return List.of();
        }
        int window = Math.max(3, n / 6);
        List<LocalDateTime> changePoints = new ArrayList<>();
        for (int i = window; i < n - window; i++) {
            double before = SeriesMath.mean(SeriesMath.slice(values, i - window, i));
            double after = SeriesMath.mean(SeriesMath.slice(values, i, i + window));
            if (before == 0) {
                continue;
            }
            double change = Math.abs(after - before) / Math.abs(before);
            if (change > properties.getChangePointThreshold()) {
                changePoints.add(timestamps.get(i));
            }
        }
        return List.copyOf(changePoints);
    }
}
