package com.blockmorph.render;

import com.blockmorph.morph.FrameBudget;
import com.blockmorph.morph.FrameSequence;
import java.util.Objects;

public final class Playback {

    private Playback() {
    }

    public static double frameDelayMs(FrameSequence sequence) {
        Objects.requireNonNull(sequence, "sequence");
        return FrameBudget.minFrameDelayMs(sequence.cellCount(), sequence.size());
    }

    /**
     * Index to show after {@code elapsedMs} have passed since {@code currentIndex} was shown.
     * Whole frame delays advance one frame each; the result never passes the last frame.
     */
    public static int advance(FrameSequence sequence, int currentIndex, double elapsedMs) {
        Objects.requireNonNull(sequence, "sequence");
        if (currentIndex < 0 || currentIndex >= sequence.size()) {
            throw new IndexOutOfBoundsException("Frame " + currentIndex + " outside 0.." + (sequence.size() - 1));
        }
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("Elapsed time must not be negative");
        }
        long steps = (long) Math.floor(elapsedMs / frameDelayMs(sequence));
        return (int) Math.min(sequence.size() - 1L, currentIndex + steps);
    }
}
