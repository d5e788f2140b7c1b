package com.blockmorph.render;

import com.blockmorph.morph.EncoderException;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;

/**
 * Looping animated GIF through the JDK ImageIO writer. Frames are reduced to the default 256-color
 * indexed palette and carry it as a local color table.
 *
 * <p>Every frame shares that palette and delay, so the per-frame metadata is built once: the first frame
 * additionally carries the NETSCAPE loop extension.
 */
public final class GifFrameEncoder implements FrameEncoder {

    private static final String NATIVE_FORMAT = "javax_imageio_gif_image_1.0";

    private final int width;
    private final int height;
    private final int delayCs;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ImageWriter writer;
    private final ImageWriteParam writeParam;
    private final ImageOutputStream outputStream;
    private final IIOMetadata firstFrameMetadata;
    private final IIOMetadata frameMetadata;
    private boolean wroteFrame;
    private boolean finished;
    private boolean streamClosed;
    private boolean closed;

    public GifFrameEncoder(int width, int height, int frameDelayMs) throws IOException {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("GIF dimensions must be positive");
        }
        if (frameDelayMs <= 0) {
            throw new IllegalArgumentException("Delay must be positive");
        }
        this.width = width;
        this.height = height;
        this.delayCs = toCentiseconds(frameDelayMs);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersBySuffix("gif");
        if (!writers.hasNext()) {
            throw new EncoderException("No GIF ImageWriter found on classpath");
        }
        this.writer = writers.next();
        this.writeParam = writer.getDefaultWriteParam();

        BufferedImage template = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_INDEXED);
        this.firstFrameMetadata = frameMetadata(template, true);
        this.frameMetadata = frameMetadata(template, false);

        this.outputStream = ImageIO.createImageOutputStream(buffer);
        this.writer.setOutput(outputStream);
        this.writer.prepareWriteSequence(null);
    }

    /**
     * GIF delays are stored in hundredths of a second.
     */
    static int toCentiseconds(int delayMs) {
        return Math.max(1, Math.round(delayMs / 10.0f));
    }

    public int delayCs() {
        return delayCs;
    }

    @Override
    public void writeFrame(BufferedImage frame) throws IOException {
        ensureWritable();
        if (frame.getWidth() < width || frame.getHeight() < height) {
            throw new IllegalArgumentException("Frame dimensions do not match encoder dimensions");
        }
        IIOMetadata metadata = wroteFrame ? frameMetadata : firstFrameMetadata;
        writer.writeToSequence(new IIOImage(toIndexed(frame), null, metadata), writeParam);
        wroteFrame = true;
    }

    @Override
    public byte[] finish() throws IOException {
        ensureWritable();
        finished = true;
        writer.endWriteSequence();
        streamClosed = true;
        outputStream.close();
        return buffer.toByteArray();
    }

    private void ensureWritable() {
        if (closed) {
            throw new IllegalStateException("Encoder already closed");
        }
        if (finished) {
            throw new IllegalStateException("Encoder already finished");
        }
    }

    private BufferedImage toIndexed(BufferedImage frame) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_INDEXED);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.drawImage(frame, 0, 0, width, height, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private IIOMetadata frameMetadata(BufferedImage template, boolean loop) throws IOException {
        IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(template), writeParam);
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(NATIVE_FORMAT);

        IIOMetadataNode control = childOf(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", "none");
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        control.setAttribute("transparentColorIndex", "0");
        control.setAttribute("delayTime", Integer.toString(delayCs));

        IIOMetadataNode descriptor = childOf(root, "ImageDescriptor");
        descriptor.setAttribute("imageLeftPosition", "0");
        descriptor.setAttribute("imageTopPosition", "0");
        descriptor.setAttribute("imageWidth", Integer.toString(width));
        descriptor.setAttribute("imageHeight", Integer.toString(height));
        descriptor.setAttribute("interlaceFlag", "FALSE");

        root.replaceChild(colorTable((IndexColorModel) template.getColorModel()), childOf(root, "LocalColorTable"));
        if (loop) {
            IIOMetadataNode netscape = new IIOMetadataNode("ApplicationExtension");
            netscape.setAttribute("applicationID", "NETSCAPE");
            netscape.setAttribute("authenticationCode", "2.0");
            // sub-block 1, loop count 0 = forever
            netscape.setUserObject(new byte[]{1, 0, 0});
            childOf(root, "ApplicationExtensions").appendChild(netscape);
        }
        metadata.setFromTree(NATIVE_FORMAT, root);
        return metadata;
    }

    private static IIOMetadataNode colorTable(IndexColorModel palette) {
        IIOMetadataNode table = new IIOMetadataNode("LocalColorTable");
        int size = palette.getMapSize();
        table.setAttribute("sizeOfLocalColorTable", Integer.toString(size));
        table.setAttribute("sortFlag", "FALSE");
        for (int index = 0; index < size; index++) {
            IIOMetadataNode entry = new IIOMetadataNode("ColorTableEntry");
            entry.setAttribute("index", Integer.toString(index));
            entry.setAttribute("red", Integer.toString(palette.getRed(index)));
            entry.setAttribute("green", Integer.toString(palette.getGreen(index)));
            entry.setAttribute("blue", Integer.toString(palette.getBlue(index)));
            table.appendChild(entry);
        }
        return table;
    }

    private static IIOMetadataNode childOf(IIOMetadataNode parent, String name) {
        for (int i = 0; i < parent.getLength(); i++) {
            if (name.equals(parent.item(i).getNodeName())) {
                return (IIOMetadataNode) parent.item(i);
            }
        }
        IIOMetadataNode child = new IIOMetadataNode(name);
        parent.appendChild(child);
        return child;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!streamClosed) {
                streamClosed = true;
                outputStream.close();
            }
        } finally {
            writer.dispose();
        }
    }
}
