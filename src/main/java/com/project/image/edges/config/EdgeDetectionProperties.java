package com.project.image.edges.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Edge detection settings.
 */
@ConfigurationProperties(prefix = "app.edges")
public class EdgeDetectionProperties {

    public enum Policy { FIXED, RELATIVE }

    /** fixed: absolute levels; relative: fractions of the strongest gradient in the image */
    private Policy thresholdPolicy = Policy.FIXED;

    /** Absolute hysteresis levels on the unnormalized Sobel scale */
    private float highThreshold = 40f;
    private float lowThreshold = 15f;

    /** high = relativeHighRatio * max gradient, low = relativeLowRatio * high */
    private float relativeHighRatio = 0.15f;
    private float relativeLowRatio = 0.4f;

    /** Background detection threads */
    private int workerThreads = 2;

    /** Largest accepted width or height of an uploaded image */
    private int maxDimension = 4000;

    private long maxUploadBytes = 10L * 1024 * 1024;

    public Policy getThresholdPolicy() { return thresholdPolicy; }
    public void setThresholdPolicy(Policy thresholdPolicy) { this.thresholdPolicy = thresholdPolicy; }

    public float getHighThreshold() { return highThreshold; }
    public void setHighThreshold(float highThreshold) { this.highThreshold = highThreshold; }

    public float getLowThreshold() { return lowThreshold; }
    public void setLowThreshold(float lowThreshold) { this.lowThreshold = lowThreshold; }

    public float getRelativeHighRatio() { return relativeHighRatio; }
    public void setRelativeHighRatio(float relativeHighRatio) { this.relativeHighRatio = relativeHighRatio; }

    public float getRelativeLowRatio() { return relativeLowRatio; }
    public void setRelativeLowRatio(float relativeLowRatio) { this.relativeLowRatio = relativeLowRatio; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public int getMaxDimension() { return maxDimension; }
    public void setMaxDimension(int maxDimension) { this.maxDimension = maxDimension; }

    public long getMaxUploadBytes() { return maxUploadBytes; }
    public void setMaxUploadBytes(long maxUploadBytes) { this.maxUploadBytes = maxUploadBytes; }
}
