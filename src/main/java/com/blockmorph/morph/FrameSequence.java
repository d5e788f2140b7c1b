package com.blockmorph.morph;

import java.util.List;
import java.util.Objects;

/**
 * Fully materialized, replayable animation. Indexable for scrubbing and re-export.
 */
public final class FrameSequence {

    private final GridDimensions dimensions;
    private final List<Frame> frames;

    public FrameSequence(GridDimensions dimensions, List<Frame> frames) {
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
        this.frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
        if (this.frames.isEmpty()) {
            throw new IllegalArgumentException("Frame sequence must contain at least one frame");
        }
    }

    public GridDimensions dimensions() {
        return dimensions;
    }

    public int width() {
        return dimensions.width();
    }

    public int height() {
        return dimensions.height();
    }

    public int cellCount() {
        return dimensions.cellCount();
    }

    public int size() {
        return frames.size();
    }

    public Frame get(int index) {
        if (index < 0 || index >= frames.size()) {
            throw new IndexOutOfBoundsException("Frame " + index + " outside 0.." + (frames.size() - 1));
        }
        return frames.get(index);
    }

    public Frame first() {
        return frames.get(0);
    }

    public Frame last() {
        return frames.get(frames.size() - 1);
    }

    public List<Frame> frames() {
        return frames;
    }
}
