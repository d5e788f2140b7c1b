package com.blockmorph.service;

import com.blockmorph.morph.Assignment;
import com.blockmorph.morph.Cell;
import com.blockmorph.morph.FrameSequence;
import com.blockmorph.morph.GridDimensions;
import com.blockmorph.morph.MorphSettings;
import java.util.List;

/**
 * Everything one pipeline invocation produced. Replaced wholesale by the next run.
 */
public record MorphRun(
        MorphSettings settings,
        GridDimensions dimensions,
        List<Cell> sourceCells,
        List<Cell> targetCells,
        Assignment assignment,
        FrameSequence frames
) {
    public MorphRun {
        sourceCells = List.copyOf(sourceCells);
        targetCells = List.copyOf(targetCells);
    }

    public int cellCount() {
        return dimensions.cellCount();
    }

    public String summary() {
        return settings.serialize();
    }
}
