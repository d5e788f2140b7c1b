package com.blockmorph.web;

public record MorphResponse(
        int gridWidth,
        int gridHeight,
        int cellSize,
        int columns,
        int rows,
        int cellCount,
        int frameCount,
        double gradientWeight,
        int durationMs,
        int fps,
        double totalCost,
        String summary
) {
}
