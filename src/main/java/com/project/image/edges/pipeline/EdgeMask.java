package com.project.image.edges.pipeline;

import java.util.Arrays;

/** Tri-state hysteresis classification, one state per pixel. */
public final class EdgeMask {
    public static final byte NONE = 0;
    public static final byte WEAK = 1;
    public static final byte STRONG = 2;

    private final int width;
    private final int height;
    private final byte[] states;

    EdgeMask(int width, int height, byte[] states) {
        this.width = width;
        this.height = height;
        this.states = states;
    }

    public int width() { return width; }

    public int height() { return height; }

    public byte state(int index) {
        return states[index];
    }

    public byte state(int x, int y) {
        return states[y * width + x];
    }

    public int count(byte state) {
        int n = 0;
        for (byte s : states) {
            if (s == state) n++;
        }
        return n;
    }

    byte[] copyStates() {
        return Arrays.copyOf(states, states.length);
    }
}
