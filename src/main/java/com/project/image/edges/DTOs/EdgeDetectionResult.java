package com.project.image.edges.DTOs;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Output of one detection run.
 * The mask is copied on the way in and on the way out, so a result never changes after it is built.
 *
 * @param mask one byte per pixel, row-major: 0 = not edge, (byte) 255 = edge
 * @param boundingBox present iff at least one edge pixel exists
 * @param anchors empty iff the bounding box is absent
 */
public record EdgeDetectionResult(
        int width,
        int height,
        byte[] mask,
        Optional<BoundingBox> boundingBox,
        List<AnchorPoint> anchors
) {
    public static final byte EDGE = (byte) 255;
    public static final byte NOT_EDGE = 0;

    public EdgeDetectionResult {
        mask = mask.clone();
        anchors = List.copyOf(anchors);
    }

    @Override
    public byte[] mask() {
        return mask.clone();
    }

    public boolean isEdge(int x, int y) {
        return mask[y * width + x] == EDGE;
    }

    public int edgePixelCount() {
        int count = 0;
        for (byte b : mask) {
            if (b == EDGE) count++;
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeDetectionResult other)) return false;
        return width == other.width
                && height == other.height
                && Arrays.equals(mask, other.mask)
                && boundingBox.equals(other.boundingBox)
                && anchors.equals(other.anchors);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + Arrays.hashCode(mask);
        result = 31 * result + boundingBox.hashCode();
        return 31 * result + anchors.hashCode();
    }

    @Override
    public String toString() {
        return "EdgeDetectionResult[width=" + width + ", height=" + height
                + ", edgePixels=" + edgePixelCount() + ", boundingBox=" + boundingBox
                + ", anchors=" + anchors.size() + "]";
    }
}
