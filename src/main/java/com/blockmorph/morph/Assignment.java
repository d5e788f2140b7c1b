package com.blockmorph.morph;

import java.util.List;
import java.util.Objects;

/**
 * Pairing of source cells to target cells, in the order targets were assigned.
 */
public final class Assignment {

    private final List<Match> matches;

    public Assignment(List<Match> matches) {
        this.matches = List.copyOf(Objects.requireNonNull(matches, "matches"));
    }

    public static Assignment empty() {
        return new Assignment(List.of());
    }

    public List<Match> matches() {
        return matches;
    }

    public int size() {
        return matches.size();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public double totalCost() {
        double total = 0;
        for (Match match : matches) {
            total += match.cost();
        }
        return total;
    }

    /**
     * True when every index in 0..n-1 occurs exactly once as a source and once as a target.
     */
    public boolean isBijection(int n) {
        if (matches.size() != n) {
            return false;
        }
        boolean[] sources = new boolean[n];
        boolean[] targets = new boolean[n];
        for (Match match : matches) {
            int s = match.sourceIndex();
            int t = match.targetIndex();
            if (s < 0 || s >= n || t < 0 || t >= n || sources[s] || targets[t]) {
                return false;
            }
            sources[s] = true;
            targets[t] = true;
        }
        return true;
    }
}
