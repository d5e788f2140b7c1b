package com.blockmorph.morph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class AnimationSynthesizer {

    private AnimationSynthesizer() {
    }

    /**
     * Builds the complete frame sequence that moves every assigned source cell from its own position
     * to its target's position with cubic ease-in-out.
     *
     * <p>The step count comes from {@link FrameBudget}; the sequence holds {@code totalFrames + 1} frames,
     * the first at the exact source positions and the last at the exact target positions.
     */
    public static FrameSequence synthesize(
            GridDimensions dimensions,
            List<Cell> sources,
            List<Cell> targets,
            Assignment assignment,
            int durationMs,
            int nominalFps) {
        Objects.requireNonNull(dimensions, "dimensions");
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(targets, "targets");
        Objects.requireNonNull(assignment, "assignment");
        if (sources.size() != targets.size()) {
            throw new MismatchedCellCountException(sources.size(), targets.size());
        }

        int totalFrames = FrameBudget.totalFrames(sources.size(), durationMs, nominalFps);
        List<Match> matches = assignment.matches();
        List<Frame> frames = new ArrayList<>(totalFrames + 1);
        for (int frame = 0; frame <= totalFrames; frame++) {
            double progress = (double) frame / totalFrames;
            double eased = Easing.easeInOutCubic(progress);
            List<Placement> placements = new ArrayList<>(matches.size());
            for (Match match : matches) {
                Cell source = sources.get(match.sourceIndex());
                Cell target = targets.get(match.targetIndex());
                placements.add(new Placement(
                        source,
                        Easing.lerp(source.x(), target.x(), eased),
                        Easing.lerp(source.y(), target.y(), eased)));
            }
            frames.add(new Frame(progress, placements));
        }
        return new FrameSequence(dimensions, frames);
    }
}
