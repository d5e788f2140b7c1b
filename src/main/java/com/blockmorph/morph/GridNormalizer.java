package com.blockmorph.morph;

public final class GridNormalizer {

    private GridNormalizer() {
    }

    /**
     * Picks the largest canvas on which both images yield the same whole-cell grid.
     *
     * @throws DegenerateGridException if either image is smaller than one cell in some direction
     */
    public static GridDimensions normalize(int width1, int height1, int width2, int height2, int cellSize) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
        if (width1 < 0 || height1 < 0 || width2 < 0 || height2 < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative");
        }
        int columns = Math.min(width1 / cellSize, width2 / cellSize);
        int rows = Math.min(height1 / cellSize, height2 / cellSize);
        if (columns == 0 || rows == 0) {
            throw new DegenerateGridException("Images " + width1 + "x" + height1 + " and " + width2 + "x" + height2
                    + " produce an empty grid for cell size " + cellSize);
        }
        return new GridDimensions(columns * cellSize, rows * cellSize, cellSize);
    }
}
