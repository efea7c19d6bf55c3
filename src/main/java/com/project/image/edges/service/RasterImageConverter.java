package com.project.image.edges.service;

import com.project.image.edges.DTOs.RasterImage;
import com.project.image.edges.exceptions.PixelAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.io.InputStream;
import javax.imageio.ImageIO;

/** Decodes uploaded images and exposes their pixels as RGBA rasters. */
@Component
public class RasterImageConverter {
    private static final Logger log = LoggerFactory.getLogger(RasterImageConverter.class);

    public BufferedImage decode(InputStream in) {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new PixelAccessException("Could not read image data", e);
        }
        if (image == null) {
            throw new PixelAccessException("File is not a readable image or is corrupted");
        }
        log.debug("Decoded image {}x{} (type {})", image.getWidth(), image.getHeight(), image.getType());
        return image;
    }

    public RasterImage toRaster(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        BufferedImage abgr = new BufferedImage(w, h, BufferedImage.TYPE_4BYTE_ABGR);
        Graphics2D graphics = abgr.createGraphics();
        graphics.setComposite(AlphaComposite.Src);
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();

        byte[] src = ((DataBufferByte) abgr.getRaster().getDataBuffer()).getData();
        byte[] rgba = new byte[src.length];
        for (int i = 0; i < src.length; i += 4) {
            rgba[i]     = src[i + 3];
            rgba[i + 1] = src[i + 2];
            rgba[i + 2] = src[i + 1];
            rgba[i + 3] = src[i];
        }
        return new RasterImage(w, h, rgba);
    }
}
