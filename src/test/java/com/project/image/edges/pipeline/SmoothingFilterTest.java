package com.project.image.edges.pipeline;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class SmoothingFilterTest {
    private final SmoothingFilter filter = new SmoothingFilter();

    @Test
    void smooth_keepsTwoPixelBorderAtZero() {
        float[] values = new float[10 * 8];
        Arrays.fill(values, 100f);
        ScalarField smoothed = filter.smooth(ScalarField.of(10, 8, values));

        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 10; x++) {
                boolean interior = x >= 2 && x < 8 && y >= 2 && y < 6;
                if (interior) {
                    assertThat(smoothed.get(x, y)).isEqualTo(100f);
                } else {
                    assertThat(smoothed.get(x, y)).as("(%d,%d)", x, y).isZero();
                }
            }
        }
    }

    @Test
    void smooth_impulseSpreadsAsBinomialKernel() {
        float[] values = new float[9 * 9];
        values[4 * 9 + 4] = 256f;
        ScalarField smoothed = filter.smooth(ScalarField.of(9, 9, values));

        // outer product of [1 4 6 4 1] normalized by 256
        assertThat(smoothed.get(4, 4)).isEqualTo(36f);
        assertThat(smoothed.get(3, 4)).isEqualTo(24f);
        assertThat(smoothed.get(3, 3)).isEqualTo(16f);
        assertThat(smoothed.get(2, 4)).isEqualTo(6f);
        assertThat(smoothed.get(2, 2)).isEqualTo(1f);
    }

    @Test
    void smooth_doesNotTouchInput() {
        float[] values = new float[7 * 7];
        Arrays.fill(values, 3f);
        ScalarField input = ScalarField.of(7, 7, values);

        filter.smooth(input);

        assertThat(input.toArray()).containsOnly(3f);
    }
}
