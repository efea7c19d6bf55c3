package com.project.image.edges.exceptions;

/** Base of all failures raised by an edge detection run. A failed run never yields a mask. */
public class EdgeDetectionException extends RuntimeException {
    public EdgeDetectionException(String message) { super(message); }
    public EdgeDetectionException(String message, Throwable cause) { super(message, cause); }
}
