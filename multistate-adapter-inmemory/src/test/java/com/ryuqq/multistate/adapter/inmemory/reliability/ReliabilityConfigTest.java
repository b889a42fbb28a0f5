package com.ryuqq.multistate.adapter.inmemory.reliability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ReliabilityConfig}.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
class ReliabilityConfigTest {

    @Test
    @DisplayName("Default config uses penalty 2.0 clamped to [1.0, 10.0]")
    void defaults() {
        ReliabilityConfig config = new ReliabilityConfig();

        assertThat(config.costMultiplierOnFailure()).isEqualTo(2.0);
        assertThat(config.minCostMultiplier()).isEqualTo(1.0);
        assertThat(config.maxCostMultiplier()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Multiplier grows linearly with failure rate and is clamped")
    void multiplierFor_ClampsToBounds() {
        ReliabilityConfig config = new ReliabilityConfig();

        assertThat(config.multiplierFor(0.0)).isEqualTo(1.0);
        assertThat(config.multiplierFor(0.25)).isCloseTo(1.25, within(1e-9));
        assertThat(config.multiplierFor(1.0)).isEqualTo(2.0);
        assertThat(config.withCostMultiplierOnFailure(50.0).multiplierFor(1.0)).isEqualTo(10.0);
        assertThat(config.withMinCostMultiplier(1.5).multiplierFor(0.0)).isEqualTo(1.5);
    }

    @Test
    @DisplayName("with* methods return modified copies")
    void withMethods_ReturnCopies() {
        ReliabilityConfig config = new ReliabilityConfig();

        ReliabilityConfig modified = config.withMaxCostMultiplier(5.0);

        assertThat(modified.maxCostMultiplier()).isEqualTo(5.0);
        assertThat(config.maxCostMultiplier()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void constructor_InvalidValues_ThrowsException() {
        assertThatThrownBy(() -> new ReliabilityConfig(0.5, 1.0, 10.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("costMultiplierOnFailure must be >= 1.0");
        assertThatThrownBy(() -> new ReliabilityConfig(2.0, -0.1, 10.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("minCostMultiplier must be >= 0.0");
        assertThatThrownBy(() -> new ReliabilityConfig(2.0, 3.0, 2.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxCostMultiplier must be >= minCostMultiplier");
        assertThatThrownBy(() -> new ReliabilityConfig(Double.NaN, 1.0, 10.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
