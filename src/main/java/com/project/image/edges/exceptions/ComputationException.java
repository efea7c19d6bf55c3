package com.project.image.edges.exceptions;

public class ComputationException extends EdgeDetectionException {
    public ComputationException(String message) { super(message); }
    public ComputationException(String message, Throwable cause) { super(message, cause); }
}
