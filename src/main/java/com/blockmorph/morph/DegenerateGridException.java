package com.blockmorph.morph;

/**
 * Raised when normalization leaves no whole cell in either dimension.
 */
public class DegenerateGridException extends IllegalArgumentException {

    public DegenerateGridException(String message) {
        super(message);
    }
}
