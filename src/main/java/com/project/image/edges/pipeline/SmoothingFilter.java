package com.project.image.edges.pipeline;

/**
 * Separable 5x5 binomial blur ([1 4 6 4 1] / 16 per pass, sigma about 1).
 * Pixels closer than {@link #INSET} to any border are not computed and stay 0.
 */
public class SmoothingFilter {
    public static final int INSET = 2;

    private static final int[] KERNEL = {1, 4, 6, 4, 1};
    private static final float NORM = 16f;

    public ScalarField smooth(ScalarField intensity) {
        final int w = intensity.width(), h = intensity.height();
        float[] temp = new float[w * h];
        float[] blurred = new float[w * h];

        // horizontal
        for (int y = 0; y < h; y++) {
            for (int x = INSET; x < w - INSET; x++) {
                float sum = 0f;
                for (int k = -INSET; k <= INSET; k++) {
                    sum += intensity.get(y * w + x + k) * KERNEL[k + INSET];
                }
                temp[y * w + x] = sum / NORM;
            }
        }

        // vertical
        for (int x = INSET; x < w - INSET; x++) {
            for (int y = INSET; y < h - INSET; y++) {
                float sum = 0f;
                for (int k = -INSET; k <= INSET; k++) {
                    sum += temp[(y + k) * w + x] * KERNEL[k + INSET];
                }
                blurred[y * w + x] = sum / NORM;
            }
        }
        return ScalarField.of(w, h, blurred);
    }
}
