package com.blockmorph.morph;

import java.util.List;

public record Frame(double progress, List<Placement> placements) {

    public Frame {
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("Progress must lie in [0, 1]");
        }
        placements = List.copyOf(placements);
    }

    public boolean isBoundary() {
        return progress == 0.0 || progress == 1.0;
    }
}
