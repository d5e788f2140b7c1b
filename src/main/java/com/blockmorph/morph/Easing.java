package com.blockmorph.morph;

public final class Easing {

    private Easing() {
    }

    /**
     * Cubic ease-in-out; maps 0 to exactly 0 and 1 to exactly 1.
     */
    public static double easeInOutCubic(double t) {
        if (t < 0.5) {
            return 4 * t * t * t;
        }
        double u = -2 * t + 2;
        return 1 - u * u * u / 2;
    }

    /**
     * Interpolates so that t = 0 and t = 1 return the endpoints bit for bit.
     */
    public static double lerp(double start, double end, double t) {
        return start * (1 - t) + end * t;
    }
}
