package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.EdgeDetectionResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class HysteresisLinkerTest {
    private static final Thresholds THRESHOLDS = new Thresholds(15f, 40f);

    private final HysteresisLinker linker = new HysteresisLinker();

    private static ScalarField grid(String... rows) {
        int w = rows[0].length(), h = rows.length;
        float[] v = new float[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                char c = rows[y].charAt(x);
                v[y * w + x] = c == 'S' ? 50f : c == 'w' ? 20f : c == '.' ? 0f : 5f;
            }
        }
        return ScalarField.of(w, h, v);
    }

    @Test
    void classify_appliesBothThresholdsInclusively() {
        ScalarField f = ScalarField.of(4, 1, new float[]{40f, 39.9f, 15f, 14.9f});

        EdgeMask mask = linker.classify(f, THRESHOLDS);

        assertThat(mask.state(0)).isEqualTo(EdgeMask.STRONG);
        assertThat(mask.state(1)).isEqualTo(EdgeMask.WEAK);
        assertThat(mask.state(2)).isEqualTo(EdgeMask.WEAK);
        assertThat(mask.state(3)).isEqualTo(EdgeMask.NONE);
    }

    @Test
    void classify_zeroIsNeverAnEdgeEvenWithZeroThresholds() {
        ScalarField f = ScalarField.of(2, 1, new float[]{0f, 0.5f});

        EdgeMask mask = linker.classify(f, new Thresholds(0f, 0f));

        assertThat(mask.state(0)).isEqualTo(EdgeMask.NONE);
        assertThat(mask.state(1)).isEqualTo(EdgeMask.STRONG);
    }

    @Test
    void link_promotesWeakChainsTouchingStrongThroughDiagonals() {
        EdgeMask classified = linker.classify(grid(
                "S.....",
                ".w....",
                "..w..w",
                "...w..",
                "......"
        ), THRESHOLDS);

        byte[] mask = linker.link(classified);

        assertThat(mask[0]).isEqualTo(EdgeDetectionResult.EDGE);
        assertThat(mask[6 + 1]).isEqualTo(EdgeDetectionResult.EDGE);
        assertThat(mask[12 + 2]).isEqualTo(EdgeDetectionResult.EDGE);
        assertThat(mask[18 + 3]).isEqualTo(EdgeDetectionResult.EDGE);
        // isolated weak pixel is dropped
        assertThat(mask[12 + 5]).isEqualTo(EdgeDetectionResult.NOT_EDGE);
    }

    @Test
    void link_weakOnlyThroughNoneGapStaysOff() {
        EdgeMask classified = linker.classify(grid(
                "S.w",
                "...",
                "..w"
        ), THRESHOLDS);

        byte[] mask = linker.link(classified);

        assertThat(mask[2]).isEqualTo(EdgeDetectionResult.NOT_EDGE);
        assertThat(mask[8]).isEqualTo(EdgeDetectionResult.NOT_EDGE);
        assertThat(mask[0]).isEqualTo(EdgeDetectionResult.EDGE);
    }

    @Test
    void link_leavesClassificationUntouched() {
        EdgeMask classified = linker.classify(grid("Sw", "ww"), THRESHOLDS);

        linker.link(classified);

        assertThat(classified.count(EdgeMask.WEAK)).isEqualTo(3);
        assertThat(classified.count(EdgeMask.STRONG)).isEqualTo(1);
    }

    @Test
    void link_largeWeakRegionFromSingleSeed_doesNotOverflowStack() {
        int w = 1000, h = 1000;
        float[] v = new float[w * h];
        Arrays.fill(v, 20f);
        v[0] = 50f;

        byte[] mask = linker.link(linker.classify(ScalarField.of(w, h, v), THRESHOLDS));

        int edges = 0;
        for (byte b : mask) {
            if (b == EdgeDetectionResult.EDGE) edges++;
        }
        assertThat(edges).isEqualTo(w * h);
    }
}
