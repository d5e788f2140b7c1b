package com.blockmorph.web;

import com.blockmorph.morph.EncoderException;
import com.blockmorph.morph.MorphSettings;
import com.blockmorph.render.ExportResult;
import com.blockmorph.render.OutputFormat;
import com.blockmorph.service.ExportJob;
import com.blockmorph.service.MorphRun;
import com.blockmorph.service.MorphService;
import com.blockmorph.service.NoRunAvailableException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping
public class MorphController {

    private static final Logger log = LoggerFactory.getLogger(MorphController.class);

    private final MorphService morphService;

    public MorphController(MorphService morphService) {
        this.morphService = morphService;
    }

    @PostMapping(path = "/morph", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public MorphResponse morph(
            @RequestPart("source") MultipartFile source,
            @RequestPart("target") MultipartFile target,
            @RequestParam(required = false) Integer cellSize,
            @RequestParam(required = false) Double gradientWeight,
            @RequestParam(required = false) Integer durationMs,
            @RequestParam(required = false) Integer fps) {
        BufferedImage sourceImage = readImage(source, "source");
        BufferedImage targetImage = readImage(target, "target");

        MorphSettings settings;
        try {
            settings = buildSettings(cellSize, gradientWeight, durationMs, fps);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }

        MorphRun run;
        try {
            run = morphService.run(sourceImage, targetImage, settings);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Morph failed: " + ex.getMessage(), ex);
        }

        return new MorphResponse(
                run.dimensions().width(),
                run.dimensions().height(),
                run.dimensions().cellSize(),
                run.dimensions().columns(),
                run.dimensions().rows(),
                run.cellCount(),
                run.frames().size(),
                settings.gradientWeight(),
                settings.targetDurationMs(),
                settings.nominalFps(),
                run.assignment().totalCost(),
                run.summary());
    }

    @GetMapping(path = "/frames/{index}", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> frame(@PathVariable int index) {
        try {
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_PNG_VALUE)
                    .body(morphService.renderFramePng(index));
        } catch (NoRunAvailableException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (IndexOutOfBoundsException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    @PostMapping(path = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ExportResponse export(
            @RequestParam(required = false) String format,
            @RequestParam(required = false) Integer durationMs) {
        OutputFormat outputFormat = parseFormat(format);
        validateDuration(durationMs);
        ExportResult result;
        try {
            result = morphService.exportLast(outputFormat, durationMs);
        } catch (NoRunAvailableException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (EncoderException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }

        Path savedPath;
        try {
            savedPath = morphService.persistLastMedia(result.bytes(), result.format());
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }

        log.info("Exported {} {} ({} frames)", result.format(), result.fileName(), result.framesEncoded());
        return new ExportResponse(
                result.fileName(),
                result.format().name(),
                result.mediaType(),
                result.framesEncoded(),
                result.frameDelayMs(),
                result.durationMs(),
                result.bytes().length,
                savedPath.toString());
    }

    @PostMapping(path = "/exports", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportJobResponse> startExport(
            @RequestParam(required = false) String format,
            @RequestParam(required = false) Integer durationMs) {
        OutputFormat outputFormat = parseFormat(format);
        validateDuration(durationMs);
        try {
            ExportJob job = morphService.startExport(outputFormat, durationMs);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(job));
        } catch (NoRunAvailableException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    @GetMapping(path = "/exports/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ExportJobResponse exportStatus(@PathVariable String id) {
        return toResponse(requireJob(id));
    }

    @DeleteMapping(path = "/exports/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ExportJobResponse cancelExport(@PathVariable String id) {
        ExportJob job = requireJob(id);
        job.cancel();
        return toResponse(job);
    }

    @GetMapping(path = "/exports/{id}/media")
    public ResponseEntity<byte[]> exportMedia(@PathVariable String id) {
        ExportJob job = requireJob(id);
        ExportResult result = job.result()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Export " + id + " is " + job.state()));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, result.mediaType())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(result.fileName()).build().toString())
                .body(result.bytes());
    }

    @GetMapping(path = "/last.gif")
    public ResponseEntity<byte[]> getLastGif() {
        return readLastMedia(OutputFormat.GIF);
    }

    @GetMapping(path = "/last.mp4")
    public ResponseEntity<byte[]> getLastMp4() {
        return readLastMedia(OutputFormat.MP4);
    }

    private ResponseEntity<byte[]> readLastMedia(OutputFormat format) {
        Path path = morphService.lastMediaPath(format);
        if (!Files.exists(path)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No " + format.name() + " exported yet");
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_TYPE, format.mediaType())
                    .body(bytes);
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read " + format.name(), ex);
        }
    }

    private BufferedImage readImage(MultipartFile file, String label) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing " + label + " image");
        }
        try (InputStream input = file.getInputStream()) {
            BufferedImage image = ImageIO.read(input);
            if (image == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported " + label + " image format");
            }
            return image;
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read " + label + " image", ex);
        }
    }

    private MorphSettings buildSettings(Integer cellSize, Double gradientWeight, Integer durationMs, Integer fps) {
        MorphSettings.Builder builder = morphService.defaultSettings().toBuilder();
        if (cellSize != null) {
            builder.cellSize(cellSize);
        }
        if (gradientWeight != null) {
            builder.gradientWeight(gradientWeight);
        }
        if (durationMs != null) {
            builder.targetDurationMs(durationMs);
        }
        if (fps != null) {
            builder.nominalFps(fps);
        }
        return builder.build();
    }

    private OutputFormat parseFormat(String format) {
        if (!StringUtils.hasText(format)) {
            return OutputFormat.GIF;
        }
        String normalized = format.trim().toUpperCase(Locale.ROOT);
        try {
            return OutputFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported format: " + format, ex);
        }
    }

    private void validateDuration(Integer durationMs) {
        if (durationMs != null && durationMs <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Duration must be positive");
        }
    }

    private ExportJob requireJob(String id) {
        return morphService.findExport(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown export " + id));
    }

    private ExportJobResponse toResponse(ExportJob job) {
        return new ExportJobResponse(
                job.id(),
                job.format().name(),
                job.state().name(),
                job.progress(),
                job.result().map(ExportResult::fileName).orElse(null),
                job.failureMessage().orElse(null));
    }
}
