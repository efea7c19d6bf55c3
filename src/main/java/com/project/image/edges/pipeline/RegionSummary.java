package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.AnchorPoint;
import com.project.image.edges.DTOs.BoundingBox;

import java.util.List;
import java.util.Optional;

public record RegionSummary(Optional<BoundingBox> boundingBox, List<AnchorPoint> anchors) {

    public static RegionSummary empty() {
        return new RegionSummary(Optional.empty(), List.of());
    }
}
