package com.project.image.edges.pipeline;

/** Sobel magnitude plus direction in degrees, range (-180, 180]. */
public record GradientField(ScalarField magnitude, ScalarField direction) {}
