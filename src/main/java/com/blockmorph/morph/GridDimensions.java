package com.blockmorph.morph;

/**
 * Shared canvas size for a pair of images, always a whole number of cells in each direction.
 */
public record GridDimensions(int width, int height, int cellSize) {

    public GridDimensions {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
        if (width <= 0 || height <= 0) {
            throw new DegenerateGridException("Grid " + width + "x" + height + " holds no whole cell of size " + cellSize);
        }
        if (width % cellSize != 0 || height % cellSize != 0) {
            throw new IllegalArgumentException("Grid " + width + "x" + height + " is not a multiple of cell size " + cellSize);
        }
    }

    public int columns() {
        return width / cellSize;
    }

    public int rows() {
        return height / cellSize;
    }

    public int cellCount() {
        return columns() * rows();
    }
}
