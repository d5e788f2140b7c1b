package com.blockmorph.web;

public record ExportJobResponse(
        String id,
        String format,
        String state,
        double progress,
        String fileName,
        String message
) {
}
