package com.blockmorph.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ProgressLogger {

    private static final Logger log = LoggerFactory.getLogger(ProgressLogger.class);

    private final String label;
    private final int totalFrames;
    private final int stepPercent;
    private int nextPercent;
    private int lastLoggedPercent;

    private ProgressLogger(String label, int totalFrames, int stepPercent) {
        this.label = label;
        this.totalFrames = Math.max(totalFrames, 1);
        this.stepPercent = stepPercent;
        this.nextPercent = stepPercent;
        this.lastLoggedPercent = 0;
    }

    static ProgressLogger create(String label, Integer requestedPercentStep, int totalFrames) {
        if (requestedPercentStep == null) {
            return null;
        }
        return new ProgressLogger(label, totalFrames, requestedPercentStep);
    }

    void record(int framesRendered) {
        int percent = (int) Math.floor(framesRendered * 100.0 / totalFrames);
        percent = Math.min(percent, 100);
        while (nextPercent <= 100 && percent >= nextPercent) {
            log.info("{}: encoded {}% of frames ({}/{}).", label, nextPercent, framesRendered, totalFrames);
            lastLoggedPercent = nextPercent;
            nextPercent += stepPercent;
        }
        if (percent == 100 && lastLoggedPercent < 100) {
            log.info("{}: encoded 100% of frames ({}/{}).", label, framesRendered, totalFrames);
            lastLoggedPercent = 100;
        }
    }
}
