package com.blockmorph.service;

import com.blockmorph.render.ExportMonitor;
import com.blockmorph.render.ExportResult;
import com.blockmorph.render.OutputFormat;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for an export running on the task executor.
 */
public final class ExportJob implements ExportMonitor {

    public enum State {
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private final String id;
    private final OutputFormat format;
    private final Instant createdAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile State state = State.RUNNING;
    private volatile double progress;
    private volatile ExportResult result;
    private volatile String failureMessage;

    ExportJob(String id, OutputFormat format) {
        this.id = id;
        this.format = format;
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public OutputFormat format() {
        return format;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public State state() {
        return state;
    }

    public double progress() {
        return progress;
    }

    public Optional<ExportResult> result() {
        return Optional.ofNullable(result);
    }

    public Optional<String> failureMessage() {
        return Optional.ofNullable(failureMessage);
    }

    public boolean isFinished() {
        return state != State.RUNNING;
    }

    /**
     * Requests cancellation; takes effect before the next frame is rendered.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelRequested.get();
    }

    @Override
    public void onProgress(double fraction) {
        this.progress = fraction;
    }

    void complete(ExportResult exportResult) {
        this.result = exportResult;
        this.progress = 1.0;
        this.state = State.COMPLETED;
    }

    void fail(String message) {
        this.failureMessage = message;
        this.state = State.FAILED;
    }

    void markCancelled() {
        this.state = State.CANCELLED;
    }
}
