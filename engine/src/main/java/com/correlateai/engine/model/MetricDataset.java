package com.correlateai.engine.model;

import com.correlateai.engine.exception.AnalysisException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of named metric series sharing a time axis. Series may have
 * different lengths; pairs are aligned on their common timestamps.
 */
public final class MetricDataset {

    private final Map<String, MetricSeries> seriesByName;

    public MetricDataset(Collection<MetricSeries> series) {
        Map<String, MetricSeries> byName = new LinkedHashMap<>();
        for (MetricSeries s : series) {
            if (byName.putIfAbsent(s.name(), s) != null) {
                throw new AnalysisException("Duplicate metric name in dataset: " + s.name());
            }
        }
        this.seriesByName = Collections.unmodifiableMap(byName);
    }

    public static MetricDataset of(MetricSeries... series) {
        return new MetricDataset(List.of(series));
    }

    public Optional<MetricSeries> series(String name) {
        return Optional.ofNullable(seriesByName.get(name));
    }

    public MetricSeries require(String name) {
        MetricSeries series = seriesByName.get(name);
        if (series == null) {
            throw new AnalysisException("Unknown metric: " + name);
        }
        return series;
    }

    public List<String> metricNames() {
        return List.copyOf(seriesByName.keySet());
    }

    /**
     * Names to analyze: every metric when {@code metricNames} is null or empty,
     * otherwise the requested names in order with duplicates dropped.
     */
    public List<String> resolve(List<String> metricNames) {
        if (metricNames == null || metricNames.isEmpty()) {
            return metricNames();
        }
        List<String> names = new ArrayList<>();
        for (String name : metricNames) {
            require(name);
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        return List.copyOf(names);
    }

    public int size() {
        return seriesByName.size();
    }

    /**
     * Keeps only the timestamps present in both series, in ascending order.
     */
    public AlignedPair align(String firstName, String secondName) {
        MetricSeries first = require(firstName);
        MetricSeries second = require(secondName);

        Map<LocalDateTime, Double> secondByTime = new LinkedHashMap<>();
        for (MetricPoint point : second.points()) {
            secondByTime.put(point.timestamp(), point.value());
        }

        List<LocalDateTime> timestamps = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        for (MetricPoint point : first.points()) {
            Double other = secondByTime.get(point.timestamp());
            if (other != null) {
                timestamps.add(point.timestamp());
                rows.add(new double[]{point.value(), other});
            }
        }

        double[] a = new double[rows.size()];
        double[] b = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            a[i] = rows.get(i)[0];
            b[i] = rows.get(i)[1];
        }
        return new AlignedPair(firstName, secondName, List.copyOf(timestamps), a, b);
    }
}
