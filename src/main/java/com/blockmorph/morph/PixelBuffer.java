package com.blockmorph.morph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Row-major RGBA pixel data, four bytes per pixel.
 */
public final class PixelBuffer {

    public static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final byte[] rgba;

    public PixelBuffer(int width, int height, byte[] rgba) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Pixel buffer dimensions must be positive");
        }
        Objects.requireNonNull(rgba, "rgba");
        if (rgba.length != width * height * CHANNELS) {
            throw new IllegalArgumentException("Expected " + (width * height * CHANNELS) + " RGBA bytes but found " + rgba.length);
        }
        this.width = width;
        this.height = height;
        this.rgba = rgba.clone();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public byte[] rgba() {
        return rgba.clone();
    }

    public int red(int x, int y) {
        return rgba[offset(x, y)] & 0xFF;
    }

    public int green(int x, int y) {
        return rgba[offset(x, y) + 1] & 0xFF;
    }

    public int blue(int x, int y) {
        return rgba[offset(x, y) + 2] & 0xFF;
    }

    public int alpha(int x, int y) {
        return rgba[offset(x, y) + 3] & 0xFF;
    }

    /**
     * Copies a rectangle out of this buffer into a new tightly packed RGBA array.
     */
    public byte[] region(int x, int y, int regionWidth, int regionHeight) {
        if (x < 0 || y < 0 || regionWidth <= 0 || regionHeight <= 0
                || x + regionWidth > width || y + regionHeight > height) {
            throw new IndexOutOfBoundsException("Region (" + x + ", " + y + ", " + regionWidth + "x" + regionHeight
                    + ") exceeds " + width + "x" + height + " buffer");
        }
        byte[] out = new byte[regionWidth * regionHeight * CHANNELS];
        int rowBytes = regionWidth * CHANNELS;
        for (int row = 0; row < regionHeight; row++) {
            System.arraycopy(rgba, offset(x, y + row), out, row * rowBytes, rowBytes);
        }
        return out;
    }

    private int offset(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Coordinates out of range: (" + x + ", " + y + ")");
        }
        return (y * width + x) * CHANNELS;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PixelBuffer other)) {
            return false;
        }
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(height);
        result = 31 * result + Arrays.hashCode(rgba);
        return result;
    }
}
