package com.project.image.edges.pipeline;

import com.project.image.edges.DTOs.EdgeDetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;

/**
 * Double thresholding followed by 8-connected propagation of STRONG through WEAK pixels.
 * Propagation uses an explicit worklist, never recursion.
 */
public class HysteresisLinker {
    private static final Logger log = LoggerFactory.getLogger(HysteresisLinker.class);

    public EdgeMask classify(ScalarField suppressed, Thresholds thresholds) {
        final int n = suppressed.size();
        byte[] states = new byte[n];
        for (int i = 0; i < n; i++) {
            float v = suppressed.get(i);
            // zero means suppressed or never computed
            if (v <= 0f) continue;
            if (v >= thresholds.high()) {
                states[i] = EdgeMask.STRONG;
            } else if (v >= thresholds.low()) {
                states[i] = EdgeMask.WEAK;
            }
        }
        return new EdgeMask(suppressed.width(), suppressed.height(), states);
    }

    /** Returns a binary mask: {@link EdgeDetectionResult#EDGE} or {@link EdgeDetectionResult#NOT_EDGE}. */
    public byte[] link(EdgeMask classified) {
        final int w = classified.width(), h = classified.height();
        byte[] states = classified.copyStates();
        ArrayDeque<Integer> worklist = new ArrayDeque<>();

        for (int i = 0; i < states.length; i++) {
            if (states[i] == EdgeMask.STRONG) worklist.push(i);
        }
        int seeds = worklist.size();
        int promoted = 0;

        while (!worklist.isEmpty()) {
            int curr = worklist.pop();
            int cx = curr % w, cy = curr / w;
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    int nx = cx + dx, ny = cy + dy;
                    if (nx < 0 || nx >= w || ny < 0 || ny >= h) continue;
                    int nIdx = ny * w + nx;
                    if (states[nIdx] == EdgeMask.WEAK) {
                        states[nIdx] = EdgeMask.STRONG;
                        worklist.push(nIdx);
                        promoted++;
                    }
                }
            }
        }
        log.debug("Hysteresis linking: {} strong seeds, {} weak pixels promoted", seeds, promoted);

        byte[] mask = new byte[states.length];
        for (int i = 0; i < states.length; i++) {
            mask[i] = states[i] == EdgeMask.STRONG ? EdgeDetectionResult.EDGE : EdgeDetectionResult.NOT_EDGE;
        }
        return mask;
    }
}
