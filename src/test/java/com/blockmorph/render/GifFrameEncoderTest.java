package com.blockmorph.render;

import static org.junit.jupiter.api.Assertions.*;

import com.blockmorph.morph.TestImages;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import org.junit.jupiter.api.Test;

class GifFrameEncoderTest {

    @Test
    void writesReadableAnimatedGif() throws IOException {
        GifFrameEncoder encoder = new GifFrameEncoder(12, 8, 40);
        encoder.writeFrame(TestImages.pattern(12, 8, 1));
        encoder.writeFrame(TestImages.pattern(12, 8, 2));
        encoder.writeFrame(TestImages.pattern(12, 8, 3));
        byte[] bytes = encoder.finish();
        encoder.close();

        assertEquals("GIF89a", new String(bytes, 0, 6, StandardCharsets.US_ASCII));

        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            assertTrue(readers.hasNext());
            ImageReader reader = readers.next();
            try {
                reader.setInput(input);
                assertEquals(3, reader.getNumImages(true));
                BufferedImage first = reader.read(0);
                assertEquals(12, first.getWidth());
                assertEquals(8, first.getHeight());

                IIOMetadataNode firstTree = nativeTree(reader, 0);
                IIOMetadataNode loop = (IIOMetadataNode) firstTree.getElementsByTagName("ApplicationExtension").item(0);
                assertEquals("NETSCAPE", loop.getAttribute("applicationID"));
                for (int i = 0; i < 3; i++) {
                    IIOMetadataNode control = (IIOMetadataNode) nativeTree(reader, i)
                            .getElementsByTagName("GraphicControlExtension").item(0);
                    assertEquals("4", control.getAttribute("delayTime"));
                }
                assertEquals(0, nativeTree(reader, 1).getElementsByTagName("ApplicationExtension").getLength());
            } finally {
                reader.dispose();
            }
        }
    }

    private static IIOMetadataNode nativeTree(ImageReader reader, int index) throws IOException {
        IIOMetadata metadata = reader.getImageMetadata(index);
        return (IIOMetadataNode) metadata.getAsTree(metadata.getNativeMetadataFormatName());
    }

    @Test
    void delaysAreRoundedToCentiseconds() throws IOException {
        assertEquals(2, GifFrameEncoder.toCentiseconds(24));
        assertEquals(3, GifFrameEncoder.toCentiseconds(26));
        assertEquals(1, GifFrameEncoder.toCentiseconds(1));
        GifFrameEncoder encoder = new GifFrameEncoder(4, 4, 100);
        assertEquals(10, encoder.delayCs());
        encoder.close();
    }

    @Test
    void finishEndsTheSequence() throws IOException {
        try (GifFrameEncoder encoder = new GifFrameEncoder(4, 4, 50)) {
            encoder.writeFrame(TestImages.pattern(4, 4, 9));
            assertTrue(encoder.finish().length > 0);
            assertThrows(IllegalStateException.class, encoder::finish);
            assertThrows(IllegalStateException.class, () -> encoder.writeFrame(TestImages.pattern(4, 4, 9)));
        }
    }

    @Test
    void closingWithoutFinishingIsAllowed() throws IOException {
        GifFrameEncoder encoder = new GifFrameEncoder(4, 4, 50);
        encoder.writeFrame(TestImages.pattern(4, 4, 9));
        encoder.close();
        encoder.close();
        assertThrows(IllegalStateException.class, encoder::finish);
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new GifFrameEncoder(0, 4, 50));
        assertThrows(IllegalArgumentException.class, () -> new GifFrameEncoder(4, 4, 0));
    }
}
