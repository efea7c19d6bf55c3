package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.AnchorPoint;
import com.project.image.edges.DTOs.BoundingBox;
import com.project.image.edges.DTOs.ColorTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional heuristic: five anchors at fixed fractions of the bounding box.
 * Viewers render these as markers, so ids, offsets and texts are part of the output contract.
 */
public class FixedOffsetAnchorStrategy implements AnchorStrategy {

    private record Template(String id, double fx, double fy, ColorTag tag, String label, String description) {}

    private static final List<Template> TEMPLATES = List.of(
            new Template("roi-a", 0.5, 0.2, ColorTag.PRIMARY,
                    "Upper Contrast Region", "High-density contrast region detected."),
            new Template("roi-b", 0.5, 0.5, ColorTag.PRIMARY,
                    "Central Axis", "Midpoint of the detected structure along its axis."),
            new Template("roi-c", 0.2, 0.55, ColorTag.SECONDARY,
                    "Left Lateral Field", "Left lateral band of detected edges."),
            new Template("roi-d", 0.8, 0.55, ColorTag.SECONDARY,
                    "Right Lateral Field", "Right lateral band of detected edges."),
            new Template("roi-e", 0.5, 0.9, ColorTag.TERTIARY,
                    "Base Region", "Lower boundary band of the detected structure.")
    );

    @Override
    public List<AnchorPoint> anchorsFor(BoundingBox box) {
        List<AnchorPoint> anchors = new ArrayList<>(TEMPLATES.size());
        for (Template t : TEMPLATES) {
            anchors.add(new AnchorPoint(
                    t.id(),
                    box.minX() + box.spanX() * t.fx(),
                    box.minY() + box.spanY() * t.fy(),
                    t.tag(), t.label(), t.description()));
        }
        return List.copyOf(anchors);
    }
}
