package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.InvalidInputException;

/** RGBA raster to luma intensity (ITU-R BT.601 weights). Alpha is ignored. */
public class LumaReducer {

    public ScalarField reduce(RasterImage image) {
        requireValid(image);
        int n = image.pixelCount();
        byte[] src = image.pixels();
        float[] gray = new float[n];
        for (int i = 0; i < n; i++) {
            int r = src[4 * i] & 0xFF, g = src[4 * i + 1] & 0xFF, b = src[4 * i + 2] & 0xFF;
            gray[i] = 0.299f * r + 0.587f * g + 0.114f * b;
        }
        return ScalarField.of(image.width(), image.height(), gray);
    }

    public static void requireValid(RasterImage image) {
        if (image == null) {
            throw new InvalidInputException("Raster image is required");
        }
        if (image.width() <= 0 || image.height() <= 0) {
            throw new InvalidInputException("Raster dimensions must be positive, got "
                    + image.width() + "x" + image.height());
        }
        long expected = 4L * image.width() * image.height();
        if (image.pixels() == null || image.pixels().length != expected) {
            throw new InvalidInputException("Pixel buffer length "
                    + (image.pixels() == null ? "null" : image.pixels().length)
                    + " does not match 4*" + image.width() + "*" + image.height() + " = " + expected);
        }
    }
}
