package com.blockmorph.morph;

/**
 * Frame-rate cap and frame ceiling for a grid of a given size. Larger grids get fewer frames so that
 * synthesis, playback and export stay bounded.
 *
 * @param maxFps      upper bound on the frame rate, {@link Integer#MAX_VALUE} when uncapped
 * @param frameCeiling upper bound on the interpolation steps, {@link Integer#MAX_VALUE} when uncapped
 */
public record FrameBudget(int maxFps, int frameCeiling) {

    public static final int MIN_FRAMES = 6;
    public static final int MIN_EXPORT_DELAY_MS = 10;
    public static final int EXPORT_MS_PER_FRAME = 60;
    public static final int MIN_EXPORT_DURATION_MS = 1500;
    public static final int MAX_EXPORT_DURATION_MS = 5000;

    private static final int UNBOUNDED = Integer.MAX_VALUE;

    public FrameBudget {
        if (maxFps <= 0 || frameCeiling < MIN_FRAMES) {
            throw new IllegalArgumentException("Frame budget must allow a positive fps and at least " + MIN_FRAMES + " frames");
        }
    }

    public static FrameBudget forCellCount(int cellCount) {
        if (cellCount < 0) {
            throw new IllegalArgumentException("Cell count must not be negative");
        }
        int fps;
        if (cellCount > 10000) {
            fps = 10;
        } else if (cellCount > 4000) {
            fps = 15;
        } else if (cellCount > 1000) {
            fps = 20;
        } else {
            fps = UNBOUNDED;
        }
        int ceiling;
        if (cellCount > 8000) {
            ceiling = 8;
        } else if (cellCount > 4000) {
            ceiling = 10;
        } else if (cellCount > 2000) {
            ceiling = 14;
        } else if (cellCount > 1000) {
            ceiling = 18;
        } else {
            ceiling = UNBOUNDED;
        }
        return new FrameBudget(fps, ceiling);
    }

    public int adjustedFps(int nominalFps) {
        if (nominalFps <= 0) {
            throw new IllegalArgumentException("Fps must be positive");
        }
        return Math.min(nominalFps, maxFps);
    }

    /**
     * Number of interpolation steps; the synthesized sequence holds one more frame than this.
     */
    public int totalFrames(int durationMs, int nominalFps) {
        if (durationMs <= 0) {
            throw new IllegalArgumentException("Duration must be positive");
        }
        long baseFrames = (long) durationMs * adjustedFps(nominalFps) / 1000L;
        return (int) Math.max(MIN_FRAMES, Math.min(frameCeiling, baseFrames));
    }

    public static int totalFrames(int cellCount, int durationMs, int nominalFps) {
        return forCellCount(cellCount).totalFrames(durationMs, nominalFps);
    }

    /**
     * Wall-clock length of live playback, stretched a little for very large grids.
     */
    public static int playbackDurationMs(int cellCount) {
        if (cellCount > 8000) {
            return 2400;
        }
        if (cellCount > 4000) {
            return 2000;
        }
        if (cellCount > 1500) {
            return 1800;
        }
        return 1600;
    }

    public static double minFrameDelayMs(int cellCount, int frameCount) {
        if (frameCount <= 0) {
            throw new IllegalArgumentException("Frame count must be positive");
        }
        return (double) playbackDurationMs(cellCount) / frameCount;
    }

    public static int exportDurationMs(int frameCount) {
        long auto = (long) frameCount * EXPORT_MS_PER_FRAME;
        return (int) Math.min(MAX_EXPORT_DURATION_MS, Math.max(MIN_EXPORT_DURATION_MS, auto));
    }

    /**
     * Per-frame delay for an export, truncated to whole milliseconds.
     */
    public static int exportFrameDelayMs(int durationMs, int frameCount) {
        if (durationMs <= 0) {
            throw new IllegalArgumentException("Duration must be positive");
        }
        if (frameCount <= 0) {
            throw new IllegalArgumentException("Frame count must be positive");
        }
        return Math.max(MIN_EXPORT_DELAY_MS, durationMs / frameCount);
    }
}
