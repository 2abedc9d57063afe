package com.correlateai.engine.model;

import com.correlateai.engine.exception.InvalidSeriesException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named, time ordered sequence of observations for one business metric.
 * Timestamps are strictly increasing and every value is finite.
 */
public final class MetricSeries {

    private final String name;
    private final List<MetricPoint> points;

    public MetricSeries(String name, List<MetricPoint> points) {
        if (name == null || name.isBlank()) {
            throw new InvalidSeriesException("Metric name must not be blank");
        }
        if (points == null) {
            throw new InvalidSeriesException("Series " + name + " has no points");
        }
        List<MetricPoint> copy = new ArrayList<>(points.size());
        LocalDateTime previous = null;
        for (MetricPoint point : points) {
            if (point == null || point.timestamp() == null) {
                throw new InvalidSeriesException("Series " + name + " contains a point without timestamp");
            }
            if (!Double.isFinite(point.value())) {
                throw new InvalidSeriesException("Series " + name + " has non-finite value at " + point.timestamp());
            }
            if (previous != null && !point.timestamp().isAfter(previous)) {
                throw new InvalidSeriesException("Series " + name + " timestamps not strictly increasing at " + point.timestamp());
            }
            previous = point.timestamp();
            copy.add(point);
        }
        this.name = name;
        this.points = Collections.unmodifiableList(copy);
    }

    public static MetricSeries of(String name, List<LocalDateTime> timestamps, double[] values) {
        if (timestamps.size() != values.length) {
            throw new InvalidSeriesException("Series " + name + " has " + timestamps.size()
                    + " timestamps but " + values.length + " values");
        }
        List<MetricPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(timestamps.get(i), values[i]));
        }
        return new MetricSeries(name, points);
    }

    public String name() {
        return name;
    }

    public List<MetricPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    public List<LocalDateTime> timestamps() {
        return points.stream().map(MetricPoint::timestamp).toList();
    }
}
