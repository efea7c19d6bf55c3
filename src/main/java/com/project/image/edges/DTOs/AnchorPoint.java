package com.project.image.edges.DTOs;

public record AnchorPoint(
        String id,
        double x,
        double y,
        ColorTag colorTag,
        String label,
        String description
) {}
