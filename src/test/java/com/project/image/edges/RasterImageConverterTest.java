package com.project.image.edges;

import com.project.image.edges.DTOs.EdgeDetectionResult;
import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.PixelAccessException;
import com.project.image.edges.service.EdgeDetectionService;
import com.project.image.edges.service.MaskRenderer;
import com.project.image.edges.service.RasterImageConverter;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterImageConverterTest {
    private final RasterImageConverter converter = new RasterImageConverter();
    private final MaskRenderer renderer = new MaskRenderer();

    @Test
    void toRaster_emitsRgbaInRowMajorOrder() {
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0xFF102030);
        img.setRGB(1, 0, 0xFFAABBCC);

        RasterImage raster = converter.toRaster(img);

        assertThat(raster.width()).isEqualTo(2);
        assertThat(raster.height()).isEqualTo(1);
        assertThat(raster.pixels()).containsExactly(
                0x10, 0x20, 0x30, 0xFF,
                0xAA, 0xBB, 0xCC, 0xFF);
    }

    @Test
    void decode_garbage_throwsPixelAccess() {
        byte[] notAnImage = {(byte) 0x89, 'P', 'N', 'G'};

        assertThatThrownBy(() -> converter.decode(new ByteArrayInputStream(notAnImage)))
                .isInstanceOf(PixelAccessException.class);
    }

    @Test
    void maskPng_paintsEdgesOnBlack() throws Exception {
        EdgeDetectionResult result = new EdgeDetectionService().detect(TestRasters.verticalStep(40, 40, 20));

        BufferedImage mask = ImageIO.read(new ByteArrayInputStream(renderer.maskPng(result)));

        assertThat(mask.getWidth()).isEqualTo(40);
        assertThat(mask.getRGB(0, 0) & 0xFFFFFF).isZero();
        int edgeX = result.isEdge(19, 20) ? 19 : 20;
        assertThat(mask.getRGB(edgeX, 20) & 0xFFFFFF).isEqualTo(0x00FFC8);
    }

    @Test
    void overlayPng_keepsSourceDimensions() throws Exception {
        BufferedImage src = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);
        EdgeDetectionResult result = new EdgeDetectionService().detect(converter.toRaster(src));

        BufferedImage overlay = ImageIO.read(new ByteArrayInputStream(renderer.overlayPng(src, result)));

        assertThat(overlay.getWidth()).isEqualTo(40);
        assertThat(overlay.getHeight()).isEqualTo(30);
    }
}
