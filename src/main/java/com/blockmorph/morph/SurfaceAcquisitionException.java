package com.blockmorph.morph;

/**
 * Raised when a pixel surface cannot be allocated or is unusable for the requested frame.
 */
public class SurfaceAcquisitionException extends IllegalStateException {

    public SurfaceAcquisitionException(String message) {
        super(message);
    }

    public SurfaceAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
