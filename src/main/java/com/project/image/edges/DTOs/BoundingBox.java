package com.project.image.edges.DTOs;

/** Inclusive pixel bounds of all edge pixels, top-left origin. */
public record BoundingBox(int minX, int minY, int maxX, int maxY) {

    public int spanX() {
        return maxX - minX;
    }

    public int spanY() {
        return maxY - minY;
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }
}
