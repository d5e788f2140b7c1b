package com.blockmorph.morph;

public class MismatchedCellCountException extends IllegalArgumentException {

    private final int sourceCount;
    private final int targetCount;

    public MismatchedCellCountException(int sourceCount, int targetCount) {
        super("Source and target grids must have the same cell count but found "
                + sourceCount + " and " + targetCount);
        this.sourceCount = sourceCount;
        this.targetCount = targetCount;
    }

    public int sourceCount() {
        return sourceCount;
    }

    public int targetCount() {
        return targetCount;
    }
}
