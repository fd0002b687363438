package tw.gc.strategy.validation.services.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class NormalDistributionTest {

    @Test
    @DisplayName("cdf should be one half at zero")
    void cdfAtZero() {
        assertThat(NormalDistribution.cdf(0.0)).isCloseTo(0.5, within(1e-7));
    }

    @Test
    @DisplayName("cdf should match known values")
    void cdfKnownValues() {
        assertThat(NormalDistribution.cdf(1.959964)).isCloseTo(0.975, within(1e-6));
        assertThat(NormalDistribution.cdf(-1.644854)).isCloseTo(0.05, within(1e-6));
        assertThat(NormalDistribution.cdf(1.281552)).isCloseTo(0.90, within(1e-6));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.001, 0.025, 0.1, 0.3, 0.5, 0.7, 0.9, 0.975, 0.999})
    @DisplayName("inverse cdf should invert the cdf within the approximation error")
    void inverseRoundTrip(double p) {
        assertThat(NormalDistribution.cdf(NormalDistribution.inverseCdf(p))).isCloseTo(p, within(5e-4));
    }

    @Test
    @DisplayName("inverse cdf should be antisymmetric")
    void inverseSymmetry() {
        assertThat(NormalDistribution.inverseCdf(0.1)).isCloseTo(-NormalDistribution.inverseCdf(0.9), within(1e-9));
    }

    @Test
    @DisplayName("inverse cdf at 0 or 1 should be NaN")
    void inverseAtEndpoints() {
        assertThat(NormalDistribution.inverseCdf(0.0)).isNaN();
        assertThat(NormalDistribution.inverseCdf(1.0)).isNaN();
    }
}
