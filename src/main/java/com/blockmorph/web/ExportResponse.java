package com.blockmorph.web;

public record ExportResponse(
        String fileName,
        String format,
        String mediaType,
        int framesEncoded,
        int frameDelayMs,
        int durationMs,
        long sizeBytes,
        String lastMediaPath
) {
}
