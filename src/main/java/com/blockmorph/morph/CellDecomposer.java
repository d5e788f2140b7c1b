package com.blockmorph.morph;

import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

public final class CellDecomposer {

    private CellDecomposer() {
    }

    /**
     * Slices the buffer into row-major cells (y outer, x inner) and computes each cell's signature.
     * Signatures are computed in parallel; the returned order is always row-major.
     */
    public static List<Cell> decompose(PixelBuffer buffer, int cellSize) {
        Objects.requireNonNull(buffer, "buffer");
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
        int columns = buffer.width() / cellSize;
        int rows = buffer.height() / cellSize;
        if (columns == 0 || rows == 0) {
            throw new DegenerateGridException("Buffer " + buffer.width() + "x" + buffer.height()
                    + " holds no whole cell of size " + cellSize);
        }
        return IntStream.range(0, columns * rows)
                .parallel()
                .mapToObj(index -> extractCell(buffer, cellSize, (index % columns) * cellSize, (index / columns) * cellSize))
                .toList();
    }

    private static Cell extractCell(PixelBuffer buffer, int cellSize, int x, int y) {
        byte[] pixels = buffer.region(x, y, cellSize, cellSize);
        Signature signature = SignatureExtractor.extract(pixels, cellSize, cellSize);
        return new Cell(x, y, cellSize, pixels, signature);
    }
}
