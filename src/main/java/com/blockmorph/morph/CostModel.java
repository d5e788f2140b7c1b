package com.blockmorph.morph;

import java.util.Objects;

/**
 * Dissimilarity between two cell signatures, blending edge and color distance by the gradient weight.
 */
public final class CostModel {

    /** Scale applied to the angular distance so that direction competes with magnitude. */
    public static final double ANGLE_SCALE = 10.0;

    private CostModel() {
    }

    public static double cost(Signature source, Signature target, double gradientWeight) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (Double.isNaN(gradientWeight) || gradientWeight < 0.0 || gradientWeight > 1.0) {
            throw new IllegalArgumentException("Gradient weight must be between 0.0 and 1.0 inclusive");
        }
        double gradientCost = Math.abs(source.magnitude() - target.magnitude())
                + ANGLE_SCALE * angularDistance(source.direction(), target.direction());
        return gradientWeight * gradientCost + (1.0 - gradientWeight) * colorDistance(source, target);
    }

    /**
     * Shortest distance between two angles on the circle, in [0, pi].
     */
    public static double angularDistance(double first, double second) {
        double diff = Math.abs(first - second) % (2 * Math.PI);
        return Math.min(diff, 2 * Math.PI - diff);
    }

    public static double colorDistance(Signature source, Signature target) {
        double dr = source.red() - target.red();
        double dg = source.green() - target.green();
        double db = source.blue() - target.blue();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
