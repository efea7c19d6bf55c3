package com.project.image.edges.pipeline;

import com.project.image.edges.exceptions.ComputationException;

/**
 * 3x3 Sobel operator over the smoothed field. Only pixels whose whole neighbourhood lies inside
 * the smoothed interior are computed, so the unprocessed ring is {@link #INSET} pixels wide.
 */
public class GradientEstimator {
    public static final int INSET = SmoothingFilter.INSET + 1;

    public GradientField estimate(ScalarField smoothed) {
        final int w = smoothed.width(), h = smoothed.height();
        float[] magnitude = new float[w * h];
        float[] direction = new float[w * h];

        for (int y = INSET; y < h - INSET; y++) {
            for (int x = INSET; x < w - INSET; x++) {
                float tl = smoothed.get(x - 1, y - 1), tc = smoothed.get(x, y - 1), tr = smoothed.get(x + 1, y - 1);
                float ml = smoothed.get(x - 1, y),                                  mr = smoothed.get(x + 1, y);
                float bl = smoothed.get(x - 1, y + 1), bc = smoothed.get(x, y + 1), br = smoothed.get(x + 1, y + 1);

                float gx = (tr + 2 * mr + br) - (tl + 2 * ml + bl);
                float gy = (bl + 2 * bc + br) - (tl + 2 * tc + tr);

                float mag = (float) Math.sqrt(gx * gx + gy * gy);
                if (!Float.isFinite(mag)) {
                    throw new ComputationException("Non-finite gradient magnitude at (" + x + ", " + y + ")");
                }
                int idx = y * w + x;
                magnitude[idx] = mag;
                direction[idx] = toDegrees(gx, gy);
            }
        }
        return new GradientField(ScalarField.of(w, h, magnitude), ScalarField.of(w, h, direction));
    }

    static float toDegrees(float gx, float gy) {
        float deg = (float) Math.toDegrees(Math.atan2(gy, gx));
        // atan2 returns -180 for a negative-zero gy
        return deg <= -180f ? 180f : deg;
    }
}
