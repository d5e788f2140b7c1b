package com.blockmorph.render;

import com.blockmorph.morph.EncoderException;
import com.blockmorph.morph.ExportCancelledException;
import com.blockmorph.morph.FrameBudget;
import com.blockmorph.morph.FrameSequence;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a frame sequence onto a private surface and streams it to a {@link FrameEncoder}.
 *
 * <p>The frame sequence is only read. Encoder failures surface as {@link EncoderException} and
 * cancellation as {@link ExportCancelledException}; in both cases the sequence can be exported again.
 */
public final class FrameExporter {

    private static final Logger log = LoggerFactory.getLogger(FrameExporter.class);

    /** Output frame rate for video containers. */
    public static final int VIDEO_FPS = 30;
    public static final int DEFAULT_PROGRESS_LOG_PERCENT_STEP = 25;

    private final FrameEncoderFactory encoderFactory;
    private final Integer progressLogPercentStep;

    public FrameExporter() {
        this(FrameEncoderFactory.defaults(), DEFAULT_PROGRESS_LOG_PERCENT_STEP);
    }

    public FrameExporter(FrameEncoderFactory encoderFactory, Integer progressLogPercentStep) {
        this.encoderFactory = Objects.requireNonNull(encoderFactory, "encoderFactory");
        this.progressLogPercentStep = progressLogPercentStep;
    }

    /**
     * Percent step between export progress log lines, or null when progress is not logged.
     */
    public Integer progressLogPercentStep() {
        return progressLogPercentStep;
    }

    public ExportResult export(FrameSequence sequence, OutputFormat format, int durationMs, String baseName, ExportMonitor monitor) {
        Objects.requireNonNull(sequence, "sequence");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(baseName, "baseName");
        ExportMonitor effectiveMonitor = monitor == null ? ExportMonitor.NONE : monitor;
        if (durationMs <= 0) {
            throw new IllegalArgumentException("Duration must be positive");
        }

        int[] frameIndices = frameIndices(sequence.size(), format, durationMs);
        int frameDelayMs = FrameBudget.exportFrameDelayMs(durationMs, frameIndices.length);
        BufferedImage surface = ImageSurfaces.createSurface(sequence.width(), sequence.height());
        ProgressLogger progressLogger = ProgressLogger.create(format.name(), progressLogPercentStep, frameIndices.length);

        byte[] bytes;
        int framesWritten = 0;
        try (FrameEncoder encoder = encoderFactory.create(format, sequence.width(), sequence.height(), frameDelayMs)) {
            for (int i = 0; i < frameIndices.length; i++) {
                if (effectiveMonitor.isCancelled()) {
                    throw new ExportCancelledException(i, frameIndices.length);
                }
                FrameRenderer.render(sequence.get(frameIndices[i]), surface, sequence.width(), sequence.height());
                encoder.writeFrame(surface);
                framesWritten = i + 1;
                effectiveMonitor.onProgress((double) framesWritten / frameIndices.length);
                if (progressLogger != null) {
                    progressLogger.record(framesWritten);
                }
            }
            bytes = encoder.finish();
        } catch (IOException ex) {
            log.warn("{} encoder failed after writing {} of {} frames: {}",
                    format, framesWritten, frameIndices.length, ex.getMessage());
            throw new EncoderException("Failed to encode " + format.name() + " output", ex);
        }
        String fileName = baseName + "." + format.fileExtension();
        return new ExportResult(bytes, fileName, format, frameIndices.length, frameDelayMs, durationMs);
    }

    /**
     * Which animation frame each encoded frame shows. GIF encodes every frame once; video resamples the
     * sequence to {@link #VIDEO_FPS} over the duration, pinning the first and last frames.
     */
    static int[] frameIndices(int frameCount, OutputFormat format, int durationMs) {
        if (format == OutputFormat.GIF) {
            int[] indices = new int[frameCount];
            for (int i = 0; i < frameCount; i++) {
                indices[i] = i;
            }
            return indices;
        }
        int outputFrames = (int) Math.max(2, (long) durationMs * VIDEO_FPS / 1000L);
        int[] indices = new int[outputFrames];
        int last = frameCount - 1;
        for (int i = 0; i < outputFrames; i++) {
            if (i == 0) {
                indices[i] = 0;
            } else if (i == outputFrames - 1) {
                indices[i] = last;
            } else {
                double t = (double) i / (outputFrames - 1);
                indices[i] = (int) Math.min(last, Math.round(t * last));
            }
        }
        return indices;
    }
}
