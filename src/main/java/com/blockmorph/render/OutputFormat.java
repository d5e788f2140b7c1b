package com.blockmorph.render;

public enum OutputFormat {
    GIF("gif", "image/gif"),
    MP4("mp4", "video/mp4");

    private final String extension;
    private final String mediaType;

    OutputFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String fileExtension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }
}
