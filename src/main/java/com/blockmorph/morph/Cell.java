package com.blockmorph.morph;

import java.util.Objects;

/**
 * One square region of a grid together with its pixels and signature. Immutable.
 */
public final class Cell {

    private final int x;
    private final int y;
    private final int size;
    private final byte[] rgba;
    private final int[] argb;
    private final Signature signature;

    public Cell(int x, int y, int size, byte[] rgba, Signature signature) {
        if (size <= 0) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
        Objects.requireNonNull(rgba, "rgba");
        if (rgba.length != size * size * PixelBuffer.CHANNELS) {
            throw new IllegalArgumentException("Cell of size " + size + " needs " + (size * size * PixelBuffer.CHANNELS)
                    + " RGBA bytes but found " + rgba.length);
        }
        this.x = x;
        this.y = y;
        this.size = size;
        this.rgba = rgba.clone();
        this.argb = toArgb(this.rgba);
        this.signature = Objects.requireNonNull(signature, "signature");
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    public int size() {
        return size;
    }

    public Signature signature() {
        return signature;
    }

    public byte[] rgba() {
        return rgba.clone();
    }

    /**
     * Packed ARGB view of the pixels, shared with renderers. Callers must not modify it.
     */
    public int[] argbPixels() {
        return argb;
    }

    private static int[] toArgb(byte[] rgba) {
        int[] out = new int[rgba.length / PixelBuffer.CHANNELS];
        for (int i = 0; i < out.length; i++) {
            int base = i * PixelBuffer.CHANNELS;
            int r = rgba[base] & 0xFF;
            int g = rgba[base + 1] & 0xFF;
            int b = rgba[base + 2] & 0xFF;
            int a = rgba[base + 3] & 0xFF;
            out[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
        return out;
    }

    @Override
    public String toString() {
        return "Cell(" + x + ", " + y + ", size=" + size + ")";
    }
}
