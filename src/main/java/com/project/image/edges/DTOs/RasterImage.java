package com.project.image.edges.DTOs;

/**
 * Row-major RGBA raster, 8 bits per channel. The pipeline only reads it.
 * Validation happens when a detection starts, so malformed instances can still be built
 * and are rejected with {@link com.project.image.edges.exceptions.InvalidInputException}.
 */
public record RasterImage(int width, int height, byte[] pixels) {

    public int pixelCount() {
        return width * height;
    }
}
