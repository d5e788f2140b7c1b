package com.blockmorph.render;

import com.blockmorph.morph.FrameSequence;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Cooperative playback driven by an external clock. Each {@link #tick} renders at most one frame,
 * and pausing at any point keeps the current index. Not thread-safe: one clock drives one session.
 */
public final class PlaybackSession {

    private final FrameSequence sequence;
    private final double frameDelayMs;
    private int currentIndex;
    private boolean playing;
    private boolean shownCurrent;
    private double pendingMs;

    public PlaybackSession(FrameSequence sequence) {
        this.sequence = Objects.requireNonNull(sequence, "sequence");
        this.frameDelayMs = Playback.frameDelayMs(sequence);
    }

    public int currentIndex() {
        return currentIndex;
    }

    public boolean isPlaying() {
        return playing;
    }

    public double frameDelayMs() {
        return frameDelayMs;
    }

    /**
     * Starts or resumes playback; playing from the last frame restarts at the first.
     */
    public void play() {
        if (currentIndex >= sequence.size() - 1) {
            currentIndex = 0;
        }
        playing = true;
        shownCurrent = false;
        pendingMs = 0;
    }

    public void pause() {
        playing = false;
    }

    public void seek(int index) {
        if (index < 0 || index >= sequence.size()) {
            throw new IndexOutOfBoundsException("Frame " + index + " outside 0.." + (sequence.size() - 1));
        }
        currentIndex = index;
        shownCurrent = false;
        pendingMs = 0;
    }

    /**
     * Renders the current frame without advancing, e.g. after a seek while paused.
     */
    public void renderCurrent(BufferedImage surface) {
        renderFrame(currentIndex, surface);
        shownCurrent = true;
    }

    /**
     * Accounts for {@code elapsedMs} of wall-clock time and renders the frame now due, if any.
     *
     * @return true when a frame was rendered
     */
    public boolean tick(double elapsedMs, BufferedImage surface) {
        if (!playing) {
            return false;
        }
        if (!shownCurrent) {
            renderCurrent(surface);
            pendingMs = 0;
            stopAtEnd();
            return true;
        }
        pendingMs += elapsedMs;
        int next = Playback.advance(sequence, currentIndex, pendingMs);
        if (next == currentIndex) {
            stopAtEnd();
            return false;
        }
        renderFrame(next, surface);
        pendingMs -= (next - currentIndex) * frameDelayMs;
        currentIndex = next;
        stopAtEnd();
        return true;
    }

    private void renderFrame(int index, BufferedImage surface) {
        FrameRenderer.render(sequence.get(index), surface, sequence.width(), sequence.height(), true);
    }

    private void stopAtEnd() {
        if (currentIndex >= sequence.size() - 1) {
            playing = false;
        }
    }
}
