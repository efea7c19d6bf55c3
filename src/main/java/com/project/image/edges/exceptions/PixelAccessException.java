package com.project.image.edges.exceptions;

/** Pixel data could not be read from the source image. */
public class PixelAccessException extends EdgeDetectionException {
    public PixelAccessException(String message) { super(message); }
    public PixelAccessException(String message, Throwable cause) { super(message, cause); }
}
