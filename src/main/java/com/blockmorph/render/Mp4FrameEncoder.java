package com.blockmorph.render;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.jcodec.api.awt.AWTSequenceEncoder;
import org.jcodec.common.io.NIOUtils;
import org.jcodec.common.io.SeekableByteChannel;
import org.jcodec.common.model.Rational;

/**
 * Writes an MP4 animation (H.264 baseline) from rendered frames. jcodec needs a seekable file, so frames
 * go to a temp file that {@link #close()} always removes.
 */
public final class Mp4FrameEncoder implements FrameEncoder {

    static final String TEMP_PREFIX = "block-morph-";
    private static final int MACROBLOCK = 16;

    private final int width;
    private final int height;
    private final int fps;
    private final Path tempFile;
    private final SeekableByteChannel channel;
    private final AWTSequenceEncoder encoder;
    private boolean finished;
    private boolean closed;

    public Mp4FrameEncoder(int width, int height, int frameDelayMs) throws IOException {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("MP4 dimensions must be positive");
        }
        if (frameDelayMs <= 0) {
            throw new IllegalArgumentException("Delay must be positive");
        }
        this.width = width;
        this.height = height;
        this.fps = fpsForDelay(frameDelayMs);
        this.tempFile = Files.createTempFile(TEMP_PREFIX, ".mp4");
        SeekableByteChannel opened = null;
        try {
            opened = NIOUtils.writableChannel(tempFile.toFile());
            this.encoder = new AWTSequenceEncoder(opened, Rational.R(fps, 1));
        } catch (IOException | RuntimeException ex) {
            if (opened != null) {
                opened.close();
            }
            Files.deleteIfExists(tempFile);
            throw ex;
        }
        this.channel = opened;
    }

    static int fpsForDelay(int frameDelayMs) {
        return (int) Math.max(1, Math.round(1000.0 / frameDelayMs));
    }

    public int fps() {
        return fps;
    }

    Path tempFile() {
        return tempFile;
    }

    @Override
    public void writeFrame(BufferedImage frame) throws IOException {
        ensureWritable();
        if (frame.getWidth() < width || frame.getHeight() < height) {
            throw new IllegalArgumentException("Frame dimensions do not match encoder dimensions");
        }
        encoder.encodeImage(pad(frame));
    }

    @Override
    public byte[] finish() throws IOException {
        ensureWritable();
        finished = true;
        encoder.finish();
        channel.close();
        return Files.readAllBytes(tempFile);
    }

    private void ensureWritable() {
        if (closed) {
            throw new IllegalStateException("Encoder already closed");
        }
        if (finished) {
            throw new IllegalStateException("Encoder already finished");
        }
    }

    private BufferedImage pad(BufferedImage frame) {
        int paddedWidth = alignToMacroblock(width);
        int paddedHeight = alignToMacroblock(height);
        BufferedImage image = new BufferedImage(paddedWidth, paddedHeight, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, paddedWidth, paddedHeight);
            graphics.drawImage(frame, 0, 0, width, height, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private int alignToMacroblock(int value) {
        return ((value + MACROBLOCK - 1) / MACROBLOCK) * MACROBLOCK;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }
}
