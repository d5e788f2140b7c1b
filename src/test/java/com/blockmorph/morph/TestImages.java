package com.blockmorph.morph;

import java.awt.image.BufferedImage;

/**
 * Small synthetic fixtures shared by the pipeline tests.
 */
public final class TestImages {

    private TestImages() {
    }

    public static byte[] solidRgba(int width, int height, int red, int green, int blue) {
        byte[] rgba = new byte[width * height * PixelBuffer.CHANNELS];
        for (int i = 0; i < width * height; i++) {
            int base = i * PixelBuffer.CHANNELS;
            rgba[base] = (byte) red;
            rgba[base + 1] = (byte) green;
            rgba[base + 2] = (byte) blue;
            rgba[base + 3] = (byte) 0xFF;
        }
        return rgba;
    }

    /**
     * Black on the left half, white on the right half.
     */
    public static byte[] verticalEdgeRgba(int size) {
        byte[] rgba = solidRgba(size, size, 0, 0, 0);
        for (int y = 0; y < size; y++) {
            for (int x = size / 2; x < size; x++) {
                int base = (y * size + x) * PixelBuffer.CHANNELS;
                rgba[base] = (byte) 0xFF;
                rgba[base + 1] = (byte) 0xFF;
                rgba[base + 2] = (byte) 0xFF;
            }
        }
        return rgba;
    }

    /**
     * Black on the top half, white on the bottom half.
     */
    public static byte[] horizontalEdgeRgba(int size) {
        byte[] rgba = solidRgba(size, size, 0, 0, 0);
        for (int y = size / 2; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int base = (y * size + x) * PixelBuffer.CHANNELS;
                rgba[base] = (byte) 0xFF;
                rgba[base + 1] = (byte) 0xFF;
                rgba[base + 2] = (byte) 0xFF;
            }
        }
        return rgba;
    }

    public static Cell solidCell(int x, int y, int size, int red, int green, int blue) {
        byte[] rgba = solidRgba(size, size, red, green, blue);
        return new Cell(x, y, size, rgba, SignatureExtractor.extract(rgba, size, size));
    }

    public static Cell cellWithSignature(int x, int y, Signature signature) {
        return new Cell(x, y, 1, solidRgba(1, 1, 0, 0, 0), signature);
    }

    /**
     * Deterministic colorful pattern with diagonal stripes and a radial blob, varied by {@code seed}.
     */
    public static BufferedImage pattern(int width, int height, int seed) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        double cx = width * (0.3 + 0.1 * (seed % 4));
        double cy = height * (0.6 - 0.1 * (seed % 3));
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int stripe = ((x + y * (seed + 1)) / 24) % 2 == 0 ? 40 : 200;
                double distance = Math.hypot(x - cx, y - cy);
                int red = (int) Math.min(255, distance * 255 / Math.max(width, height));
                int green = stripe;
                int blue = ((x * (seed + 3)) ^ y) & 0xFF;
                image.setRGB(x, y, 0xFF000000 | (red << 16) | (green << 8) | blue);
            }
        }
        return image;
    }

    public static PixelBuffer buffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] rgba = new byte[width * height * PixelBuffer.CHANNELS];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                int base = (y * width + x) * PixelBuffer.CHANNELS;
                rgba[base] = (byte) (argb >> 16);
                rgba[base + 1] = (byte) (argb >> 8);
                rgba[base + 2] = (byte) argb;
                rgba[base + 3] = (byte) (argb >>> 24);
            }
        }
        return new PixelBuffer(width, height, rgba);
    }
}
