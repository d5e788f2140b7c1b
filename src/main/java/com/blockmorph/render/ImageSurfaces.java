package com.blockmorph.render;

import com.blockmorph.morph.EncoderException;
import com.blockmorph.morph.GridDimensions;
import com.blockmorph.morph.PixelBuffer;
import com.blockmorph.morph.SurfaceAcquisitionException;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import javax.imageio.ImageIO;

/**
 * AWT-backed pixel surfaces: resampling decoded images, allocating render targets and PNG snapshots.
 */
public final class ImageSurfaces {

    private ImageSurfaces() {
    }

    public static BufferedImage createSurface(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new SurfaceAcquisitionException("Cannot allocate a " + width + "x" + height + " surface");
        }
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    }

    public static BufferedImage createSurface(GridDimensions dimensions) {
        Objects.requireNonNull(dimensions, "dimensions");
        return createSurface(dimensions.width(), dimensions.height());
    }

    /**
     * Scales the whole image onto the normalized canvas with bilinear filtering.
     */
    public static BufferedImage resample(BufferedImage image, GridDimensions dimensions) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(dimensions, "dimensions");
        BufferedImage scaled = new BufferedImage(dimensions.width(), dimensions.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(image, 0, 0, dimensions.width(), dimensions.height(), null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    public static PixelBuffer toPixelBuffer(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] rgba = new byte[argb.length * PixelBuffer.CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int pixel = argb[i];
            int base = i * PixelBuffer.CHANNELS;
            rgba[base] = (byte) ((pixel >> 16) & 0xFF);
            rgba[base + 1] = (byte) ((pixel >> 8) & 0xFF);
            rgba[base + 2] = (byte) (pixel & 0xFF);
            rgba[base + 3] = (byte) ((pixel >>> 24) & 0xFF);
        }
        return new PixelBuffer(width, height, rgba);
    }

    public static void fill(BufferedImage surface, Color color, int width, int height) {
        Graphics2D graphics = surface.createGraphics();
        try {
            graphics.setColor(color);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
    }

    public static BufferedImage copy(BufferedImage surface) {
        BufferedImage copy = new BufferedImage(surface.getWidth(), surface.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = copy.createGraphics();
        try {
            graphics.drawImage(surface, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return copy;
    }

    public static byte[] encodePng(BufferedImage surface) {
        Objects.requireNonNull(surface, "surface");
        try (ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            if (!ImageIO.write(surface, "png", buffer)) {
                throw new EncoderException("No PNG ImageWriter found on classpath");
            }
            return buffer.toByteArray();
        } catch (IOException ex) {
            throw new EncoderException("Failed to encode PNG frame", ex);
        }
    }
}
