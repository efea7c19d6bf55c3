package com.project.image.edges.pipeline;

/**
 * Non-maximum suppression. The direction is folded into [0, 180) and quantized into four
 * half-open bands; the center survives only if it is {@code >=} both neighbours along the gradient.
 * Image y grows downward, so 45 degrees points to (x+1, y+1).
 */
public class DirectionalSuppressor {

    public enum Band {
        HORIZONTAL(1, 0),   // [0, 22.5) and [157.5, 180)
        DIAGONAL(1, 1),     // [22.5, 67.5)
        VERTICAL(0, 1),     // [67.5, 112.5)
        ANTI_DIAGONAL(-1, 1); // [112.5, 157.5)

        final int dx;
        final int dy;

        Band(int dx, int dy) {
            this.dx = dx;
            this.dy = dy;
        }

        public static Band of(float degrees) {
            float a = degrees % 180f;
            if (a < 0f) a += 180f;
            if (a < 22.5f) return HORIZONTAL;
            if (a < 67.5f) return DIAGONAL;
            if (a < 112.5f) return VERTICAL;
            if (a < 157.5f) return ANTI_DIAGONAL;
            return HORIZONTAL;
        }
    }

    public ScalarField suppress(GradientField gradient) {
        ScalarField magnitude = gradient.magnitude();
        ScalarField direction = gradient.direction();
        final int w = magnitude.width(), h = magnitude.height();
        float[] out = new float[w * h];

        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                float mag = magnitude.get(x, y);
                if (mag == 0f) continue;

                Band band = Band.of(direction.get(x, y));
                float ahead = magnitude.getOrZero(x + band.dx, y + band.dy);
                float behind = magnitude.getOrZero(x - band.dx, y - band.dy);
                if (mag >= ahead && mag >= behind) {
                    out[y * w + x] = mag;
                }
            }
        }
        return ScalarField.of(w, h, out);
    }
}
