package com.project.image.edges.exceptions;

/** Thrown between pipeline stages once a newer detection was submitted for the same viewer. */
public class DetectionCancelledException extends EdgeDetectionException {
    private final long generation;

    public DetectionCancelledException(long generation) {
        super("Detection generation " + generation + " was superseded");
        this.generation = generation;
    }

    public long getGeneration() {
        return generation;
    }
}
