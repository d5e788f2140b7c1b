package com.blockmorph.render;

import java.io.IOException;

@FunctionalInterface
public interface FrameEncoderFactory {

    FrameEncoder create(OutputFormat format, int width, int height, int frameDelayMs) throws IOException;

    static FrameEncoderFactory defaults() {
        return (format, width, height, frameDelayMs) -> switch (format) {
            case GIF -> new GifFrameEncoder(width, height, frameDelayMs);
            case MP4 -> new Mp4FrameEncoder(width, height, frameDelayMs);
        };
    }
}
