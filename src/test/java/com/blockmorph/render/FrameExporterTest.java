package com.blockmorph.render;

import static org.junit.jupiter.api.Assertions.*;

import com.blockmorph.morph.AnimationSynthesizer;
import com.blockmorph.morph.Cell;
import com.blockmorph.morph.CellDecomposer;
import com.blockmorph.morph.EncoderException;
import com.blockmorph.morph.ExportCancelledException;
import com.blockmorph.morph.FrameSequence;
import com.blockmorph.morph.GreedyMatcher;
import com.blockmorph.morph.GridDimensions;
import com.blockmorph.morph.TestImages;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class FrameExporterTest {

    private FrameSequence sequence;

    @BeforeEach
    void setUp() {
        GridDimensions dimensions = new GridDimensions(16, 16, 4);
        List<Cell> sources = CellDecomposer.decompose(TestImages.buffer(TestImages.pattern(16, 16, 3)), 4);
        List<Cell> targets = CellDecomposer.decompose(TestImages.buffer(TestImages.pattern(16, 16, 4)), 4);
        sequence = AnimationSynthesizer.synthesize(
                dimensions, sources, targets, GreedyMatcher.match(sources, targets, 0.7), 2000, 30);
    }

    @Test
    void gifExportEncodesEveryFrameInOrder() {
        RecordingFactory factory = new RecordingFactory(-1);
        FrameExporter exporter = new FrameExporter(factory, null);

        ExportResult result = exporter.export(sequence, OutputFormat.GIF, 1500, "morph", ExportMonitor.NONE);

        assertEquals(61, result.framesEncoded());
        assertEquals(24, result.frameDelayMs());
        assertEquals(24, factory.lastDelayMs);
        assertEquals("morph.gif", result.fileName());
        assertEquals("image/gif", result.mediaType());
        assertArrayEquals(new byte[]{61}, result.bytes());

        RecordingEncoder encoder = factory.encoders.get(0);
        assertEquals(61, encoder.frames.size());
        assertTrue(encoder.finished);
        assertTrue(encoder.closed);
        assertArrayEquals(rendered(0), encoder.frames.get(0));
        assertArrayEquals(rendered(30), encoder.frames.get(30));
        assertArrayEquals(rendered(60), encoder.frames.get(60));
    }

    @Test
    void encoderFailureLeavesSequenceExportable(CapturedOutput output) {
        RecordingFactory failing = new RecordingFactory(10);
        FrameExporter exporter = new FrameExporter(failing, null);

        EncoderException ex = assertThrows(EncoderException.class,
                () -> exporter.export(sequence, OutputFormat.GIF, 1500, "morph", null));
        assertInstanceOf(IOException.class, ex.getCause());
        assertFalse(failing.encoders.get(0).finished);
        assertTrue(failing.encoders.get(0).closed);
        assertTrue(output.getAll().contains("after writing 10 of 61 frames"));
        assertEquals(61, sequence.size());

        RecordingFactory working = new RecordingFactory(-1);
        ExportResult retry = new FrameExporter(working, null)
                .export(sequence, OutputFormat.GIF, 1500, "morph", null);
        assertEquals(61, retry.framesEncoded());
    }

    @Test
    void cancellationStopsBeforeTheNextFrame() {
        RecordingFactory factory = new RecordingFactory(-1);
        FrameExporter exporter = new FrameExporter(factory, 25);
        List<Double> progress = new ArrayList<>();
        ExportMonitor monitor = new ExportMonitor() {
            @Override
            public void onProgress(double fraction) {
                progress.add(fraction);
            }

            @Override
            public boolean isCancelled() {
                return progress.size() >= 5;
            }
        };

        assertThrows(ExportCancelledException.class,
                () -> exporter.export(sequence, OutputFormat.GIF, 2000, "morph", monitor));
        assertEquals(5, factory.encoders.get(0).frames.size());
        assertFalse(factory.encoders.get(0).finished);
        assertTrue(factory.encoders.get(0).closed);
    }

    @Test
    void cancelledVideoExportRemovesItsTempFile() {
        List<Mp4FrameEncoder> created = new ArrayList<>();
        FrameEncoderFactory factory = (format, width, height, frameDelayMs) -> {
            Mp4FrameEncoder encoder = new Mp4FrameEncoder(width, height, frameDelayMs);
            created.add(encoder);
            return encoder;
        };
        int[] written = {0};
        ExportMonitor monitor = new ExportMonitor() {
            @Override
            public void onProgress(double fraction) {
                written[0]++;
            }

            @Override
            public boolean isCancelled() {
                return written[0] >= 3;
            }
        };
        FrameExporter exporter = new FrameExporter(factory, null);

        for (int attempt = 0; attempt < 3; attempt++) {
            assertThrows(ExportCancelledException.class,
                    () -> exporter.export(sequence, OutputFormat.MP4, 1000, "clip", monitor));
            written[0] = 0;
        }

        assertEquals(3, created.size());
        for (Mp4FrameEncoder encoder : created) {
            assertFalse(Files.exists(encoder.tempFile()));
        }
    }

    @Test
    void progressReachesCompletion() {
        List<Double> progress = new ArrayList<>();
        ExportMonitor monitor = new ExportMonitor() {
            @Override
            public void onProgress(double fraction) {
                progress.add(fraction);
            }
        };
        new FrameExporter(new RecordingFactory(-1), 10).export(sequence, OutputFormat.GIF, 2000, "morph", monitor);
        assertEquals(61, progress.size());
        assertEquals(1.0, progress.get(progress.size() - 1), 1e-12);
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) > progress.get(i - 1));
        }
    }

    @Test
    void videoResamplesToFixedRatePinningEndpoints() {
        int[] indices = FrameExporter.frameIndices(61, OutputFormat.MP4, 3000);
        assertEquals(90, indices.length);
        assertEquals(0, indices[0]);
        assertEquals(60, indices[indices.length - 1]);
        for (int i = 1; i < indices.length; i++) {
            assertTrue(indices[i] >= indices[i - 1]);
        }

        int[] shortClip = FrameExporter.frameIndices(61, OutputFormat.MP4, 20);
        assertArrayEquals(new int[]{0, 60}, shortClip);
    }

    @Test
    void videoExportUsesResampledFrameCount() {
        RecordingFactory factory = new RecordingFactory(-1);
        ExportResult result = new FrameExporter(factory, null)
                .export(sequence, OutputFormat.MP4, 2000, "clip", null);
        assertEquals(60, result.framesEncoded());
        assertEquals(33, result.frameDelayMs());
        assertEquals("clip.mp4", result.fileName());
        assertArrayEquals(rendered(60), factory.encoders.get(0).frames.get(59));
    }

    @Test
    void rejectsNonPositiveDuration() {
        FrameExporter exporter = new FrameExporter(new RecordingFactory(-1), null);
        assertThrows(IllegalArgumentException.class,
                () -> exporter.export(sequence, OutputFormat.GIF, 0, "morph", null));
    }

    private int[] rendered(int index) {
        BufferedImage surface = ImageSurfaces.createSurface(16, 16);
        FrameRenderer.render(sequence.get(index), surface, 16, 16);
        return surface.getRGB(0, 0, 16, 16, null, 0, 16);
    }

    private static final class RecordingFactory implements FrameEncoderFactory {
        private final int failAtFrame;
        private final List<RecordingEncoder> encoders = new ArrayList<>();
        private int lastDelayMs;

        RecordingFactory(int failAtFrame) {
            this.failAtFrame = failAtFrame;
        }

        @Override
        public FrameEncoder create(OutputFormat format, int width, int height, int frameDelayMs) {
            lastDelayMs = frameDelayMs;
            RecordingEncoder encoder = new RecordingEncoder(failAtFrame);
            encoders.add(encoder);
            return encoder;
        }
    }

    private static final class RecordingEncoder implements FrameEncoder {
        private final int failAtFrame;
        private final List<int[]> frames = new ArrayList<>();
        private boolean finished;
        private boolean closed;

        RecordingEncoder(int failAtFrame) {
            this.failAtFrame = failAtFrame;
        }

        @Override
        public void writeFrame(BufferedImage frame) throws IOException {
            if (frames.size() == failAtFrame) {
                throw new IOException("disk full");
            }
            frames.add(frame.getRGB(0, 0, 16, 16, null, 0, 16));
        }

        @Override
        public byte[] finish() {
            finished = true;
            return new byte[]{(byte) frames.size()};
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
