package org.helmsman.runtime.conflicts;

import org.helmsman.runtime.model.Value;

/**
 * Closed numeric range carried by a CLAMP write.
 *
 * @param min Lower bound.
 * @param max Upper bound, not below {@code min}.
 */
public record ClampRange(double min, double max) {

    public ClampRange {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
    }

    public double clamp(double value) {
        return Math.min(Math.max(value, min), max);
    }

    /**
     * @return the tightest range contained in both, or null if they do not overlap.
     */
    public ClampRange intersect(ClampRange other) {
        double lo = Math.max(min, other.min);
        double hi = Math.min(max, other.max);
        return lo > hi ? null : new ClampRange(lo, hi);
    }

    @Override
    public String toString() {
        return "[" + Value.formatNumber(min) + ", "
                + Value.formatNumber(max) + "]";
    }
}
