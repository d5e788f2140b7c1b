package com.blockmorph.render;

import com.blockmorph.morph.Cell;
import com.blockmorph.morph.Frame;
import com.blockmorph.morph.Placement;
import com.blockmorph.morph.SurfaceAcquisitionException;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Draws frames onto a caller-owned surface.
 *
 * <p>The surface must have a single writer for the duration of a call: live playback and export
 * never share one. This is not checked here.
 */
public final class FrameRenderer {

    public static final Color BACKGROUND = Color.WHITE;
    public static final int THINNING_THRESHOLD = 10000;
    public static final int THINNING_STRIDE = 2;

    private FrameRenderer() {
    }

    /**
     * Renders every placement in order. Used for export and any frame that must be exact.
     */
    public static void render(Frame frame, BufferedImage surface, int width, int height) {
        render(frame, surface, width, height, false);
    }

    /**
     * Clears the first {@code width x height} pixels to white and blits each placement at its rounded
     * position. With {@code allowThinning}, very large intermediate frames are drawn in two strided passes;
     * every placement is still drawn exactly once.
     */
    public static void render(Frame frame, BufferedImage surface, int width, int height, boolean allowThinning) {
        Objects.requireNonNull(frame, "frame");
        if (surface == null) {
            throw new SurfaceAcquisitionException("No surface to render onto");
        }
        if (surface.getWidth() < width || surface.getHeight() < height) {
            throw new SurfaceAcquisitionException("Surface " + surface.getWidth() + "x" + surface.getHeight()
                    + " is smaller than frame " + width + "x" + height);
        }
        ImageSurfaces.fill(surface, BACKGROUND, width, height);
        List<Placement> placements = frame.placements();
        for (int index : blitOrder(placements.size(), allowThinning && shouldThin(frame))) {
            Placement placement = placements.get(index);
            blit(surface, placement.cell(), (int) Math.round(placement.x()), (int) Math.round(placement.y()), width, height);
        }
    }

    static boolean shouldThin(Frame frame) {
        return frame.placements().size() > THINNING_THRESHOLD && !frame.isBoundary();
    }

    /**
     * Order in which placements are drawn: natural order, or stride-first then the remainder.
     */
    static int[] blitOrder(int count, boolean thin) {
        int[] order = new int[count];
        if (!thin) {
            for (int i = 0; i < count; i++) {
                order[i] = i;
            }
            return order;
        }
        int next = 0;
        for (int offset = 0; offset < THINNING_STRIDE; offset++) {
            for (int i = offset; i < count; i += THINNING_STRIDE) {
                order[next++] = i;
            }
        }
        return order;
    }

    private static void blit(BufferedImage surface, Cell cell, int x, int y, int width, int height) {
        int size = cell.size();
        int startX = Math.max(0, x);
        int startY = Math.max(0, y);
        int endX = Math.min(width, x + size);
        int endY = Math.min(height, y + size);
        if (startX >= endX || startY >= endY) {
            return;
        }
        int[] pixels = cell.argbPixels();
        int spanWidth = endX - startX;
        for (int row = startY; row < endY; row++) {
            int offset = (row - y) * size + (startX - x);
            surface.setRGB(startX, row, spanWidth, 1, pixels, offset, size);
        }
    }
}
