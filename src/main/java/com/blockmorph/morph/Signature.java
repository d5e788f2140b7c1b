package com.blockmorph.morph;

/**
 * Reduced visual descriptor of one cell: mean edge strength, mean edge orientation and mean color.
 *
 * @param magnitude mean per-pixel gradient magnitude, never negative
 * @param direction orientation of the summed gradient vector, in (-pi, pi]
 */
public record Signature(double magnitude, double direction, double red, double green, double blue) {

    public Signature {
        if (Double.isNaN(magnitude) || magnitude < 0.0) {
            throw new IllegalArgumentException("Magnitude must be non-negative");
        }
        if (Double.isNaN(direction) || direction < -Math.PI || direction > Math.PI) {
            throw new IllegalArgumentException("Direction must lie in [-pi, pi]");
        }
    }
}
