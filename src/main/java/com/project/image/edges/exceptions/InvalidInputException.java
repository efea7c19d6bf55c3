package com.project.image.edges.exceptions;

/** Malformed raster: non-positive dimensions or a buffer that is not 4 bytes per pixel. */
public class InvalidInputException extends EdgeDetectionException {
    public InvalidInputException(String message) { super(message); }
}
