package com.project.image.edges.pipeline;

/** Chooses hysteresis thresholds for one run from its pre-suppression gradient magnitude. */
public interface ThresholdPolicy {

    Thresholds thresholdsFor(ScalarField magnitude);

    /** Same thresholds for every image. */
    static ThresholdPolicy fixed(float low, float high) {
        if (!(low < high)) {
            throw new IllegalArgumentException("low threshold must be below high threshold: " + low + " >= " + high);
        }
        Thresholds thresholds = new Thresholds(low, high);
        return magnitude -> thresholds;
    }

    /** {@code high = highRatio * max(magnitude)}, {@code low = lowRatio * high}. */
    static ThresholdPolicy relative(float highRatio, float lowRatio) {
        if (highRatio <= 0f || lowRatio <= 0f || lowRatio >= 1f) {
            throw new IllegalArgumentException("Invalid relative ratios: high=" + highRatio + ", low=" + lowRatio);
        }
        return magnitude -> {
            float high = highRatio * magnitude.max();
            return new Thresholds(lowRatio * high, high);
        };
    }
}
