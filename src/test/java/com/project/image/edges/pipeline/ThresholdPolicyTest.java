package com.project.image.edges.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ThresholdPolicyTest {

    private static final ScalarField MAGNITUDE = ScalarField.copyOf(3, 1, new float[]{0f, 200f, 50f});

    @Test
    void fixed_ignoresImageContent() {
        Thresholds t = ThresholdPolicy.fixed(15f, 40f).thresholdsFor(MAGNITUDE);

        assertThat(t.low()).isEqualTo(15f);
        assertThat(t.high()).isEqualTo(40f);
    }

    @Test
    void fixed_requiresLowBelowHigh() {
        assertThatThrownBy(() -> ThresholdPolicy.fixed(40f, 40f)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ThresholdPolicy.fixed(50f, 40f)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void relative_scalesWithStrongestGradient() {
        Thresholds t = ThresholdPolicy.relative(0.15f, 0.4f).thresholdsFor(MAGNITUDE);

        assertThat(t.high()).isCloseTo(30f, within(1e-4f));
        assertThat(t.low()).isCloseTo(12f, within(1e-4f));
    }

    @Test
    void relative_onFlatFieldCollapsesToZero() {
        Thresholds t = ThresholdPolicy.relative(0.15f, 0.4f)
                .thresholdsFor(ScalarField.copyOf(2, 2, new float[4]));

        assertThat(t.high()).isZero();
        assertThat(t.low()).isZero();
    }
}
