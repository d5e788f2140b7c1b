package com.blockmorph.morph;

import java.util.Objects;

/**
 * Computes cell signatures from a Sobel gradient field over the luminance channel.
 *
 * <p>Border pixels sample their nearest in-bounds neighbour, so a cell never sees anything
 * outside its own pixels and identical pixel content always yields an identical signature.
 */
public final class SignatureExtractor {

    private SignatureExtractor() {
    }

    public static double luminance(int red, int green, int blue) {
        return 0.299 * red + 0.587 * green + 0.114 * blue;
    }

    public static Signature extract(byte[] rgba, int width, int height) {
        Objects.requireNonNull(rgba, "rgba");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Cell dimensions must be positive");
        }
        if (rgba.length != width * height * PixelBuffer.CHANNELS) {
            throw new IllegalArgumentException("Expected " + (width * height * PixelBuffer.CHANNELS) + " RGBA bytes but found " + rgba.length);
        }

        double[] gray = new double[width * height];
        double totalRed = 0;
        double totalGreen = 0;
        double totalBlue = 0;
        for (int i = 0; i < gray.length; i++) {
            int base = i * PixelBuffer.CHANNELS;
            int r = rgba[base] & 0xFF;
            int g = rgba[base + 1] & 0xFF;
            int b = rgba[base + 2] & 0xFF;
            gray[i] = luminance(r, g, b);
            totalRed += r;
            totalGreen += g;
            totalBlue += b;
        }

        double totalMagnitude = 0;
        double totalGx = 0;
        double totalGy = 0;
        for (int y = 0; y < height; y++) {
            int up = clamp(y - 1, height) * width;
            int row = y * width;
            int down = clamp(y + 1, height) * width;
            for (int x = 0; x < width; x++) {
                int left = clamp(x - 1, width);
                int right = clamp(x + 1, width);
                // 3x3 Sobel kernels, written as paired differences so flat regions give exactly zero
                double gx = (gray[up + right] - gray[up + left])
                        + 2 * (gray[row + right] - gray[row + left])
                        + (gray[down + right] - gray[down + left]);
                double gy = (gray[down + left] - gray[up + left])
                        + 2 * (gray[down + x] - gray[up + x])
                        + (gray[down + right] - gray[up + right]);
                totalMagnitude += Math.sqrt(gx * gx + gy * gy);
                totalGx += gx;
                totalGy += gy;
            }
        }

        int count = width * height;
        // mean(gy)/mean(gx) share the count, so the sums give the same angle
        double direction = Math.atan2(totalGy, totalGx);
        if (direction == -Math.PI) {
            direction = Math.PI;
        }
        return new Signature(
                totalMagnitude / count,
                direction,
                totalRed / count,
                totalGreen / count,
                totalBlue / count);
    }

    private static int clamp(int value, int limit) {
        if (value < 0) {
            return 0;
        }
        return value >= limit ? limit - 1 : value;
    }
}
