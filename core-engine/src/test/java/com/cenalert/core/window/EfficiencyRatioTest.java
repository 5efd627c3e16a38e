package com.cenalert.core.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EfficiencyRatio}.
 */
class EfficiencyRatioTest {

    @Test
    @DisplayName("A monotonic trajectory has ratio one")
    void shouldBeOneForTrend() {
        EfficiencyRatio ratio = trajectory(1, 2, 4, 8);
        assertThat(ratio.efficiencyRatio()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("A reverting trajectory has a low ratio regardless of direction")
    void shouldBeLowForReversion() {
        EfficiencyRatio up = trajectory(10, 100, 20, 100, 20, 100, 12);
        EfficiencyRatio down = trajectory(100, 10, 90, 10, 90, 10, 98);

        assertThat(up.efficiencyRatio()).isCloseTo(2.0 / 500, within(1e-12));
        assertThat(down.efficiencyRatio()).isCloseTo(2.0 / 490, within(1e-12));
    }

    @Test
    @DisplayName("Fewer than two values or a flat path yield NaN")
    void shouldBeNaNWhenUndefined() {
        assertThat(trajectory().efficiencyRatio()).isNaN();
        assertThat(trajectory(3).efficiencyRatio()).isNaN();
        assertThat(trajectory(3, 3, 3).efficiencyRatio()).isNaN();
    }

    @Test
    @DisplayName("Values after the seed exclude the first entry")
    void shouldDropSeed() {
        EfficiencyRatio ratio = trajectory(0, 5, 6);
        assertThat(ratio.withoutSeed()).containsExactly(5, 6);

        ratio.clear();
        assertThat(ratio.size()).isZero();
        assertThat(ratio.withoutSeed()).isEmpty();
    }

    private EfficiencyRatio trajectory(double... values) {
        EfficiencyRatio ratio = new EfficiencyRatio();
        for (double v : values) {
            ratio.insert(v);
        }
        return ratio;
    }
}
