package com.correlateai.engine.service.pattern;

import com.correlateai.engine.config.PatternProperties;
import com.correlateai.engine.model.TrendDirection;
import com.correlateai.engine.util.SeriesMath;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

/**
 * Least-squares trend of value against sample index, over the whole series or
 * its most recent quarter.
 */
@Service
@RequiredArgsConstructor
public class TrendService {

    private static final int MIN_FORECAST_WINDOW = 3;

    private final PatternProperties properties;

    public Trend trend(double[] values) {
        TrendFit fit = fit(values);
        if (!fit.isDefined()) {
            return new Trend(TrendDirection.STABLE, 0.0);
        }
        double strength = SeriesMath.clamp(Math.abs(fit.r()), 0.0, 1.0);
        if (fit.pValue() > properties.getTrendSignificance()) {
            return new Trend(TrendDirection.STABLE, strength);
        }
        return new Trend(TrendDirection.fromSlope(fit.slope()), strength);
    }

    public TrendDirection forecastDirection(double[] values) {
        if (values.length < MIN_FORECAST_WINDOW) {
            return TrendDirection.STABLE;
        }
        int window = Math.max(MIN_FORECAST_WINDOW, values.length / 4);
        TrendFit fit = fit(SeriesMath.tail(values, window));
        if (!fit.isDefined()
                || fit.pValue() > properties.getForecastSignificance()
                || Math.abs(fit.r()) < properties.getForecastMinCorrelation()) {
            return TrendDirection.STABLE;
        }
        return TrendDirection.fromSlope(fit.slope());
    }

    TrendFit fit(double[] values) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        if (regression.getN() < 3) {
            return new TrendFit(Double.NaN, Double.NaN, Double.NaN);
        }
        return new TrendFit(regression.getSlope(), regression.getR(), regression.getSignificance());
    }

    record TrendFit(double slope, double r, double pValue) {
        boolean isDefined() {
            return Double.isFinite(slope) && Double.isFinite(r) && Double.isFinite(pValue) && slope != 0.0;
        }
    }

    public record Trend(TrendDirection direction, double strength) {}
}
