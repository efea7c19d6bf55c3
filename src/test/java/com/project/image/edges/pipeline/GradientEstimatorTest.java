package com.project.image.edges.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GradientEstimatorTest {
    private final GradientEstimator estimator = new GradientEstimator();

    private static ScalarField field(int w, int h, java.util.function.IntBinaryOperator f) {
        float[] v = new float[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                v[y * w + x] = f.applyAsInt(x, y);
            }
        }
        return ScalarField.of(w, h, v);
    }

    @Test
    void estimate_risingHorizontalStep_pointsRight() {
        GradientField g = estimator.estimate(field(12, 12, (x, y) -> x >= 6 ? 100 : 0));

        assertThat(g.magnitude().get(5, 6)).isEqualTo(400f);
        assertThat(g.magnitude().get(6, 6)).isEqualTo(400f);
        assertThat(g.magnitude().get(4, 6)).isZero();
        assertThat(g.direction().get(5, 6)).isEqualTo(0f);
    }

    @Test
    void estimate_fallingStep_reportsPlus180() {
        GradientField g = estimator.estimate(field(12, 12, (x, y) -> x >= 6 ? 0 : 100));

        assertThat(g.direction().get(5, 6)).isEqualTo(180f);
    }

    @Test
    void estimate_brighterBelow_points90() {
        GradientField g = estimator.estimate(field(12, 12, (x, y) -> y >= 6 ? 100 : 0));

        assertThat(g.magnitude().get(6, 5)).isEqualTo(400f);
        assertThat(g.direction().get(6, 5)).isEqualTo(90f);
    }

    @Test
    void estimate_leavesThreePixelRingUncomputed() {
        GradientField g = estimator.estimate(field(12, 12, (x, y) -> x * 10));

        for (int i = 0; i < 12; i++) {
            assertThat(g.magnitude().get(2, i)).isZero();
            assertThat(g.magnitude().get(9, i)).isZero();
            assertThat(g.magnitude().get(i, 2)).isZero();
            assertThat(g.magnitude().get(i, 9)).isZero();
        }
        assertThat(g.magnitude().get(3, 3)).isEqualTo(80f);
        assertThat(g.magnitude().get(8, 8)).isEqualTo(80f);
    }

    @Test
    void toDegrees_negativeZeroNeverYieldsMinus180() {
        assertThat(GradientEstimator.toDegrees(-5f, -0f)).isEqualTo(180f);
        assertThat(GradientEstimator.toDegrees(-5f, 0f)).isEqualTo(180f);
        assertThat(GradientEstimator.toDegrees(0f, -5f)).isEqualTo(-90f);
    }
}
