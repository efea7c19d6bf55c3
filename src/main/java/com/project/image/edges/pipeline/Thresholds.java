package com.project.image.edges.pipeline;

/** Hysteresis levels on the unnormalized Sobel magnitude scale. */
public record Thresholds(float low, float high) {

    public Thresholds {
        if (!(low >= 0f) || !(high >= low)) {
            throw new IllegalArgumentException("Thresholds need 0 <= low <= high, got low=" + low + ", high=" + high);
        }
    }
}
