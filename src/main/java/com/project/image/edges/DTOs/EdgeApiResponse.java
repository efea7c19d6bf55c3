package com.project.image.edges.DTOs;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** JSON body of {@code POST /api/edges}; {@code maskPng} is serialized as base64. */
public record EdgeApiResponse(
        long generation,
        int width,
        int height,
        int edgePixels,
        BoundingBox boundingBox,
        List<AnchorPoint> anchors,
        byte[] maskPng
) {
    public EdgeApiResponse {
        anchors = List.copyOf(anchors);
        maskPng = maskPng.clone();
    }

    @Override
    public byte[] maskPng() {
        return maskPng.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeApiResponse other)) return false;
        return generation == other.generation
                && width == other.width
                && height == other.height
                && edgePixels == other.edgePixels
                && Objects.equals(boundingBox, other.boundingBox)
                && anchors.equals(other.anchors)
                && Arrays.equals(maskPng, other.maskPng);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(generation, width, height, edgePixels, boundingBox, anchors);
        return 31 * result + Arrays.hashCode(maskPng);
    }

    @Override
    public String toString() {
        return "EdgeApiResponse[generation=" + generation + ", width=" + width + ", height=" + height
                + ", edgePixels=" + edgePixels + ", boundingBox=" + boundingBox
                + ", anchors=" + anchors.size() + ", maskPng=" + maskPng.length + " bytes]";
    }
}
