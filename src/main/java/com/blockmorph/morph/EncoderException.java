package com.blockmorph.morph;

/**
 * Raised when an output encoder fails or is unavailable. Frames already synthesized are not
 * affected, so the export may be retried.
 */
public class EncoderException extends IllegalStateException {

    public EncoderException(String message) {
        super(message);
    }

    public EncoderException(String message, Throwable cause) {
        super(message, cause);
    }
}
