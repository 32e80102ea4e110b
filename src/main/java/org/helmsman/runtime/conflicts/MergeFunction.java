package org.helmsman.runtime.conflicts;

import java.util.Locale;

/**
 * Combines two numeric writes under {@link ConflictStrategy#MERGE}.
 */
public enum MergeFunction {
    AVERAGE {
        @Override
        public double apply(double kept, double incoming) {
            return (kept + incoming) / 2.0;
        }
    },
    MIN {
        @Override
        public double apply(double kept, double incoming) {
            return Math.min(kept, incoming);
        }
    },
    MAX {
        @Override
        public double apply(double kept, double incoming) {
            return Math.max(kept, incoming);
        }
    };

    public abstract double apply(double kept, double incoming);

    /**
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static MergeFunction parse(String text) {
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
