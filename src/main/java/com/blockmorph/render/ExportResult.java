package com.blockmorph.render;

public record ExportResult(
        byte[] bytes,
        String fileName,
        OutputFormat format,
        int framesEncoded,
        int frameDelayMs,
        int durationMs
) {
    public ExportResult {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public String mediaType() {
        return format.mediaType();
    }
}
