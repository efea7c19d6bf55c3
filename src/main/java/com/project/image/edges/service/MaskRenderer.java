package com.project.image.edges.service;

import com.project.image.edges.DTOs.AnchorPoint;
import com.project.image.edges.DTOs.EdgeDetectionResult;
import com.project.image.edges.exceptions.EdgeDetectionException;
import org.springframework.stereotype.Component;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

/** PNG renderings of a detection result: the bare mask and a tinted overlay with anchor markers. */
@Component
public class MaskRenderer {

    private static final Color EDGE_COLOR = new Color(0, 255, 200);
    private static final Color MASK_BACKGROUND = new Color(0, 0, 0);
    private static final float EDGE_ALPHA = 0.8f;
    private static final double ANCHOR_RADIUS = 6.0;

    public byte[] maskPng(EdgeDetectionResult result) {
        int w = result.width(), h = result.height();
        BufferedImage mask = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        int edgeARGB = 0xFF000000 | EDGE_COLOR.getRGB();
        int backgroundARGB = 0xFF000000 | MASK_BACKGROUND.getRGB();

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                mask.setRGB(x, y, result.isEdge(x, y) ? edgeARGB : backgroundARGB);
            }
        }
        return toPng(mask);
    }

    public byte[] overlayPng(BufferedImage input, EdgeDetectionResult result) {
        int w = result.width(), h = result.height();
        BufferedImage overlay = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = overlay.createGraphics();
        graphics.drawImage(input, 0, 0, null);

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!result.isEdge(x, y)) continue;
                int base = overlay.getRGB(x, y);
                int r = blend((base >> 16) & 0xFF, EDGE_COLOR.getRed());
                int g = blend((base >> 8) & 0xFF, EDGE_COLOR.getGreen());
                int b = blend(base & 0xFF, EDGE_COLOR.getBlue());
                overlay.setRGB(x, y, 0xFF000000 | (r << 16) | (g << 8) | b);
            }
        }

        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setStroke(new BasicStroke(2f));
        for (AnchorPoint anchor : result.anchors()) {
            Ellipse2D marker = new Ellipse2D.Double(anchor.x() - ANCHOR_RADIUS, anchor.y() - ANCHOR_RADIUS,
                    2 * ANCHOR_RADIUS, 2 * ANCHOR_RADIUS);
            graphics.setColor(Color.decode(anchor.colorTag().hex()));
            graphics.fill(marker);
            graphics.setColor(Color.WHITE);
            graphics.draw(marker);
        }
        graphics.dispose();
        return toPng(overlay);
    }

    private static int blend(int orig, int tint) {
        return Math.min(255, Math.round(EDGE_ALPHA * tint + (1f - EDGE_ALPHA) * orig));
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (Exception e) {
            throw new EdgeDetectionException("Failed to encode image", e);
        }
    }
}
