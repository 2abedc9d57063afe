package com.correlateai.engine.service.stats;

import com.correlateai.engine.config.CorrelationProperties;
import com.correlateai.engine.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GrangerCausalityServiceTest {

    private final GrangerCausalityService service = new GrangerCausalityService(new CorrelationProperties());

    @Test
    void tooFewSamplesGiveNoEvidence() {
        double[] a = TestSeriesFactory.gaussian(9, 0, 1, 1);
        double[] b = TestSeriesFactory.gaussian(9, 0, 1, 2);

        assertThat(service.pValue(a, b)).isEqualTo(1.0);
    }

    @Test
    void laggedDriverIsDetected() {
        double[] cause = TestSeriesFactory.gaussian(60, 0, 1, 21);
        double[] noise = TestSeriesFactory.gaussian(60, 0, 0.1, 22);
        double[] effect = new double[cause.length];
        effect[0] = noise[0];
        for (int t = 1; t < cause.length; t++) {
            effect[t] = cause[t - 1] + noise[t];
        }

        assertThat(service.pValue(cause, effect)).isLessThanOrEqualTo(0.01);
    }

    @Test
    void pValueIsFlooredAndBounded() {
        for (long seed = 1; seed <= 10; seed++) {
            double[] a = TestSeriesFactory.gaussian(30, 0, 1, seed);
            double[] b = TestSeriesFactory.gaussian(30, 0, 1, seed + 50);

            assertThat(service.pValue(a, b)).isBetween(0.001, 1.0);
        }
    }

    @Test
    void minimumLengthStillProducesAnEstimate() {
        double[] a = TestSeriesFactory.gaussian(10, 0, 1, 31);
        double[] b = TestSeriesFactory.gaussian(10, 0, 1, 32);

        assertThat(service.pValue(a, b)).isBetween(0.001, 1.0);
    }
}
