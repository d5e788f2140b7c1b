package com.blockmorph.service;

import com.blockmorph.config.AppProperties;
import com.blockmorph.morph.AnimationSynthesizer;
import com.blockmorph.morph.Assignment;
import com.blockmorph.morph.Cell;
import com.blockmorph.morph.CellDecomposer;
import com.blockmorph.morph.EncoderException;
import com.blockmorph.morph.ExportCancelledException;
import com.blockmorph.morph.FrameBudget;
import com.blockmorph.morph.FrameSequence;
import com.blockmorph.morph.GreedyMatcher;
import com.blockmorph.morph.GridDimensions;
import com.blockmorph.morph.GridNormalizer;
import com.blockmorph.morph.MismatchedCellCountException;
import com.blockmorph.morph.MorphSettings;
import com.blockmorph.render.ExportMonitor;
import com.blockmorph.render.ExportResult;
import com.blockmorph.render.FrameEncoderFactory;
import com.blockmorph.render.FrameExporter;
import com.blockmorph.render.FrameRenderer;
import com.blockmorph.render.ImageSurfaces;
import com.blockmorph.render.OutputFormat;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Service
public class MorphService {

    private static final String GIF_DIRECTORY = "gif";
    private static final String LAST_GIF_NAME = "last.gif";
    private static final String MP4_DIRECTORY = "video";
    private static final String LAST_MP4_NAME = "last.mp4";
    private static final int MAX_RETAINED_JOBS = 16;
    private static final Logger log = LoggerFactory.getLogger(MorphService.class);

    private final Path outputDirectory;
    private final MorphSettings defaultSettings;
    private final TaskExecutor taskExecutor;
    private final FrameExporter exporter;
    private final AtomicReference<MorphRun> lastRun = new AtomicReference<>();
    private final Map<String, ExportJob> jobs = new ConcurrentHashMap<>();

    @Autowired
    public MorphService(AppProperties properties, @Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor) {
        this(properties.getOutputDirectory(), properties.getDefaultSettings(), taskExecutor,
                exporterFor(properties.getDefaultSettings()));
    }

    public MorphService(Path outputDirectory, MorphSettings defaultSettings, TaskExecutor taskExecutor, FrameExporter exporter) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.defaultSettings = Objects.requireNonNull(defaultSettings, "defaultSettings");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    /**
     * Exporter with the configured progress-log step, falling back to the exporter's default.
     */
    static FrameExporter exporterFor(MorphSettings settings) {
        Integer step = settings.progressLogPercentStep();
        return new FrameExporter(FrameEncoderFactory.defaults(),
                step != null ? step : FrameExporter.DEFAULT_PROGRESS_LOG_PERCENT_STEP);
    }

    public MorphSettings defaultSettings() {
        return defaultSettings;
    }

    /**
     * Runs the whole pipeline for one image pair and makes the result the current run.
     */
    public MorphRun run(BufferedImage source, BufferedImage target, MorphSettings settings) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(settings, "settings");
        long start = System.nanoTime();

        GridDimensions dimensions = GridNormalizer.normalize(
                source.getWidth(), source.getHeight(), target.getWidth(), target.getHeight(), settings.cellSize());
        List<Cell> sourceCells = CellDecomposer.decompose(
                ImageSurfaces.toPixelBuffer(ImageSurfaces.resample(source, dimensions)), settings.cellSize());
        List<Cell> targetCells = CellDecomposer.decompose(
                ImageSurfaces.toPixelBuffer(ImageSurfaces.resample(target, dimensions)), settings.cellSize());
        if (sourceCells.size() != targetCells.size()) {
            throw new MismatchedCellCountException(sourceCells.size(), targetCells.size());
        }

        Assignment assignment = GreedyMatcher.match(sourceCells, targetCells, settings.gradientWeight());
        FrameSequence frames = AnimationSynthesizer.synthesize(
                dimensions, sourceCells, targetCells, assignment, settings.targetDurationMs(), settings.nominalFps());
        MorphRun run = new MorphRun(settings, dimensions, sourceCells, targetCells, assignment, frames);
        lastRun.set(run);

        Duration spent = Duration.ofNanos(System.nanoTime() - start);
        log.info(
                "Morph {}x{} ({} cells): {} frames, total cost {} (settings={}, spent={})",
                dimensions.width(),
                dimensions.height(),
                dimensions.cellCount(),
                frames.size(),
                String.format(Locale.US, "%.1f", assignment.totalCost()),
                run.summary(),
                String.format(Locale.US, "%.1f s", spent.toNanos() / 1_000_000_000.0));
        return run;
    }

    public Optional<MorphRun> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    /**
     * Renders one frame of the current run as PNG, for scrubbing.
     */
    public byte[] renderFramePng(int index) {
        MorphRun run = requireLastRun();
        FrameSequence frames = run.frames();
        BufferedImage surface = ImageSurfaces.createSurface(frames.dimensions());
        FrameRenderer.render(frames.get(index), surface, frames.width(), frames.height());
        return ImageSurfaces.encodePng(surface);
    }

    public ExportResult export(MorphRun run, OutputFormat format, Integer durationMs, ExportMonitor monitor) {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(format, "format");
        int effectiveDuration = durationMs != null ? durationMs : FrameBudget.exportDurationMs(run.frames().size());
        long start = System.nanoTime();
        ExportResult result = exporter.export(run.frames(), format, effectiveDuration, defaultOutputName(run), monitor);
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        log.info(
                "Exported {} {} ({} frames, delay={} ms, size={}, spent={})",
                result.fileName(),
                result.format(),
                result.framesEncoded(),
                result.frameDelayMs(),
                String.format(Locale.US, "%.1f KB", result.bytes().length / 1024.0),
                String.format(Locale.US, "%.1f s", seconds));
        return result;
    }

    public ExportResult exportLast(OutputFormat format, Integer durationMs) {
        return export(requireLastRun(), format, durationMs, ExportMonitor.NONE);
    }

    /**
     * Starts exporting the current run on the task executor.
     */
    public ExportJob startExport(OutputFormat format, Integer durationMs) {
        Objects.requireNonNull(format, "format");
        MorphRun run = requireLastRun();
        evictFinishedJobs();
        ExportJob job = new ExportJob(UUID.randomUUID().toString(), format);
        jobs.put(job.id(), job);
        try {
            taskExecutor.execute(() -> runExportJob(job, run, durationMs));
        } catch (TaskRejectedException ex) {
            log.warn("Export {} rejected by task executor: {}", job.id(), ex.getMessage());
            job.fail("Export rejected: " + ex.getMessage());
        }
        return job;
    }

    public Optional<ExportJob> findExport(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    private void runExportJob(ExportJob job, MorphRun run, Integer durationMs) {
        try {
            ExportResult result = export(run, job.format(), durationMs, job);
            persistLastMedia(result.bytes(), result.format());
            job.complete(result);
        } catch (ExportCancelledException ex) {
            log.info("Export {} cancelled: {}", job.id(), ex.getMessage());
            job.markCancelled();
        } catch (EncoderException ex) {
            job.fail(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Export {} failed", job.id(), ex);
            job.fail(ex.getMessage());
        }
    }

    private void evictFinishedJobs() {
        if (jobs.size() < MAX_RETAINED_JOBS) {
            return;
        }
        jobs.values().removeIf(ExportJob::isFinished);
    }

    public Path persistLastMedia(byte[] bytes, OutputFormat format) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(format, "format");
        try {
            return switch (format) {
                case GIF -> persist(bytes, GIF_DIRECTORY, LAST_GIF_NAME);
                case MP4 -> persist(bytes, MP4_DIRECTORY, LAST_MP4_NAME);
            };
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to persist " + format.name() + " output", ex);
        }
    }

    public Path lastMediaPath(OutputFormat format) {
        return switch (format) {
            case GIF -> outputDirectory.resolve(GIF_DIRECTORY).resolve(LAST_GIF_NAME);
            case MP4 -> outputDirectory.resolve(MP4_DIRECTORY).resolve(LAST_MP4_NAME);
        };
    }

    private Path persist(byte[] bytes, String directory, String fileName) throws IOException {
        Path dir = outputDirectory.resolve(directory);
        Files.createDirectories(dir);
        Path path = dir.resolve(fileName);
        Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return path;
    }

    private MorphRun requireLastRun() {
        MorphRun run = lastRun.get();
        if (run == null) {
            throw new NoRunAvailableException();
        }
        return run;
    }

    static String defaultOutputName(MorphRun run) {
        MorphSettings settings = run.settings();
        long weightPercent = Math.round(settings.gradientWeight() * 100.0);
        return "morph_" + settings.cellSize() + "px_w" + weightPercent + "_" + run.frames().size() + "f";
    }
}
