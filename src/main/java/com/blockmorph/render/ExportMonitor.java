package com.blockmorph.render;

/**
 * Observes a running export. Polled for cancellation before each frame.
 */
public interface ExportMonitor {

    ExportMonitor NONE = new ExportMonitor() {
    };

    default void onProgress(double fraction) {
    }

    default boolean isCancelled() {
        return false;
    }
}
