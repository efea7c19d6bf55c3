package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.AnchorPoint;
import com.project.image.edges.DTOs.BoundingBox;

import java.util.List;

/**
 * Derives labeled points of interest from the region where edges were found.
 * Implementations must place every anchor inside {@code box}.
 */
public interface AnchorStrategy {

    List<AnchorPoint> anchorsFor(BoundingBox box);
}
