package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.BoundingBox;
import com.project.image.edges.DTOs.EdgeDetectionResult;

import java.util.Optional;

/** Bounding box of the linked edge pixels plus the anchors an {@link AnchorStrategy} derives from it. */
public class RegionSummarizer {
    private final AnchorStrategy anchorStrategy;

    public RegionSummarizer(AnchorStrategy anchorStrategy) {
        this.anchorStrategy = anchorStrategy;
    }

    public RegionSummary summarize(byte[] mask, int width, int height) {
        int minX = width, maxX = -1, minY = height, maxY = -1;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i] != EdgeDetectionResult.EDGE) continue;
            int x = i % width, y = i / width;
            if (x < minX) minX = x;
            if (x > maxX) maxX = x;
            if (y < minY) minY = y;
            if (y > maxY) maxY = y;
        }
        if (maxX < 0) {
            return RegionSummary.empty();
        }
        BoundingBox box = new BoundingBox(minX, minY, maxX, maxY);
        return new RegionSummary(Optional.of(box), anchorStrategy.anchorsFor(box));
    }
}
