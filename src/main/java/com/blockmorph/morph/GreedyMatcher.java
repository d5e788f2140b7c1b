package com.blockmorph.morph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy one-sided assignment: each target in index order takes the cheapest source not yet used.
 *
 * <p>Runs in O(n^2) cost evaluations and is not globally optimal. Ties go to the lowest source index.
 * An empty pair of grids yields an empty assignment.
 */
public final class GreedyMatcher {

    private GreedyMatcher() {
    }

    public static Assignment match(List<Cell> sources, List<Cell> targets, double gradientWeight) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(targets, "targets");
        if (sources.size() != targets.size()) {
            throw new MismatchedCellCountException(sources.size(), targets.size());
        }
        int n = sources.size();
        if (n == 0) {
            return Assignment.empty();
        }
        Signature[] sourceSignatures = new Signature[n];
        for (int i = 0; i < n; i++) {
            sourceSignatures[i] = sources.get(i).signature();
        }

        boolean[] used = new boolean[n];
        List<Match> matches = new ArrayList<>(n);
        for (int targetIndex = 0; targetIndex < n; targetIndex++) {
            Signature target = targets.get(targetIndex).signature();
            int bestSource = -1;
            double bestCost = Double.POSITIVE_INFINITY;
            for (int sourceIndex = 0; sourceIndex < n; sourceIndex++) {
                if (used[sourceIndex]) {
                    continue;
                }
                double cost = CostModel.cost(sourceSignatures[sourceIndex], target, gradientWeight);
                if (bestSource < 0 || cost < bestCost) {
                    bestCost = cost;
                    bestSource = sourceIndex;
                }
            }
            used[bestSource] = true;
            matches.add(new Match(bestSource, targetIndex, bestCost));
        }
        return new Assignment(matches);
    }
}
