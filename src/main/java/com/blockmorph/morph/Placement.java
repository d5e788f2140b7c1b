package com.blockmorph.morph;

import java.util.Objects;

/**
 * Where a source cell is drawn in one frame.
 */
public record Placement(Cell cell, double x, double y) {

    public Placement {
        Objects.requireNonNull(cell, "cell");
    }
}
