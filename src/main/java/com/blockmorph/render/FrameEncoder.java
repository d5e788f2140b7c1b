package com.blockmorph.render;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;

/**
 * Serializes rendered frames into one animated blob. Frames arrive in playback order; an encoder must
 * copy whatever it needs from each image before {@link #writeFrame} returns, since the caller reuses it.
 *
 * <p>{@link #close()} releases every resource the encoder holds whether or not {@link #finish()} ran,
 * so an abandoned export leaves nothing behind.
 */
public interface FrameEncoder extends Closeable {

    void writeFrame(BufferedImage frame) throws IOException;

    /**
     * Completes the container and returns the encoded bytes. No frames may be written afterwards.
     */
    byte[] finish() throws IOException;
}
