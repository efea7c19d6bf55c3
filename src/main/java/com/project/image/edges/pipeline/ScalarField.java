package com.project.image.edges.pipeline;

import java.util.Arrays;

/**
 * Dense row-major field of floats produced by one pipeline stage.
 * The producing stage hands its buffer over through {@link #of}; afterwards the field is read-only.
 */
public final class ScalarField {
    private final int width;
    private final int height;
    private final float[] values;

    private ScalarField(int width, int height, float[] values) {
        this.width = width;
        this.height = height;
        this.values = values;
    }

    static ScalarField of(int width, int height, float[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Field buffer has " + values.length
                    + " values, expected " + width + "x" + height);
        }
        return new ScalarField(width, height, values);
    }

    public static ScalarField copyOf(int width, int height, float[] values) {
        return of(width, height, Arrays.copyOf(values, values.length));
    }

    public int width() { return width; }

    public int height() { return height; }

    public int size() { return values.length; }

    public float get(int index) {
        return values[index];
    }

    public float get(int x, int y) {
        return values[y * width + x];
    }

    /** Value at (x, y), or 0 outside the field. */
    public float getOrZero(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) return 0f;
        return values[y * width + x];
    }

    public float max() {
        float max = 0f;
        for (float v : values) {
            if (v > max) max = v;
        }
        return max;
    }

    public float[] toArray() {
        return Arrays.copyOf(values, values.length);
    }
}
