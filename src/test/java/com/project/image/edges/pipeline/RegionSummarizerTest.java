package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.AnchorPoint;
import com.project.image.edges.DTOs.BoundingBox;
import com.project.image.edges.DTOs.ColorTag;
import com.project.image.edges.DTOs.EdgeDetectionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegionSummarizerTest {

    @Test
    void summarize_emptyMask_hasNoBoxAndNoAnchors() {
        RegionSummary s = new RegionSummarizer(new FixedOffsetAnchorStrategy()).summarize(new byte[20], 5, 4);

        assertThat(s.boundingBox()).isEmpty();
        assertThat(s.anchors()).isEmpty();
    }

    @Test
    void summarize_computesInclusiveMinimalBox() {
        int w = 10, h = 8;
        byte[] mask = new byte[w * h];
        mask[2 * w + 7] = EdgeDetectionResult.EDGE;
        mask[5 * w + 3] = EdgeDetectionResult.EDGE;
        mask[6 * w + 4] = EdgeDetectionResult.EDGE;

        RegionSummary s = new RegionSummarizer(new FixedOffsetAnchorStrategy()).summarize(mask, w, h);

        assertThat(s.boundingBox()).contains(new BoundingBox(3, 2, 7, 6));
        assertThat(s.anchors()).hasSize(5);
    }

    @Test
    void summarize_delegatesAnchorsToStrategy() {
        byte[] mask = new byte[9];
        mask[4] = EdgeDetectionResult.EDGE;
        AnchorStrategy single = box ->
                List.of(new AnchorPoint("only", box.minX(), box.minY(), ColorTag.TERTIARY, "Only", "Single pixel"));

        RegionSummary s = new RegionSummarizer(single).summarize(mask, 3, 3);

        assertThat(s.boundingBox()).contains(new BoundingBox(1, 1, 1, 1));
        assertThat(s.anchors()).extracting(AnchorPoint::id).containsExactly("only");
    }
}
