package com.correlateai.engine.service.pattern;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VolatilityServiceTest {

    private final VolatilityService service = new VolatilityService();

    @Test
    void steadyGrowthHasNoVolatility() {
        double[] values = new double[12];
        values[0] = 100;
        for (int i = 1; i < values.length; i++) {
            values[i] = values[i - 1] * 1.05;
        }

        assertThat(service.score(values)).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void alternatingSwingsAreScaled() {
        // changes alternate between +10% and -1/11, population std about 0.0955
        double[] values = {100, 110, 100, 110, 100, 110, 100};

        assertThat(service.score(values)).isCloseTo(0.9545, within(0.001));
    }

    @Test
    void largeSwingsSaturate() {
        assertThat(service.score(new double[]{1, 10, 1, 10, 1})).isEqualTo(1.0);
    }

    @Test
    void zeroValuesAreLeftOutOfChanges() {
        assertThat(service.score(new double[]{0, 0, 0})).isZero();
        assertThat(service.score(new double[]{0, 5, 5, 5})).isZero();
    }
}
