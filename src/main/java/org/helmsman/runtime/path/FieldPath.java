package org.helmsman.runtime.path;

import java.util.List;
import java.util.Optional;

import org.helmsman.runtime.errors.UnknownPathException;

/**
 * A parsed, syntactically valid field path such as {@code agents.tugboat_1.speed}.
 * <p>
 * Paths are case-sensitive and dot-separated without escaping. The first segment must name one of
 * the closed set of {@link Container containers}, and the segment count must match that container.
 *
 * @param container The root container.
 * @param segments All segments including the root, never empty.
 * @param raw The original text.
 */
public record FieldPath(Container container, List<String> segments, String raw) {

    /**
     * The roots a path may start with, with the segment counts they accept.
     */
    public enum Container {
        AGENTS("agents", 3, 3),
        ENVIRONMENT("environment", 2, 2),
        GLOBAL_METRICS("global_metrics", 2, 2),
        EVENTS("events", 2, 3);

        private final String root;
        private final int minSegments;
        private final int maxSegments;

        Container(String root, int minSegments, int maxSegments) {
            this.root = root;
            this.minSegments = minSegments;
            this.maxSegments = maxSegments;
        }

        public String root() {
            return root;
        }

        static Optional<Container> fromRoot(String root) {
            for (Container container : values()) {
                if (container.root.equals(root)) {
                    return Optional.of(container);
                }
            }
            return Optional.empty();
        }
    }

    public FieldPath {
        segments = List.copyOf(segments);
    }

    /**
     * Parses a path without throwing.
     *
     * @param text Candidate path text, may be null.
     * @return the parsed path, or empty if the text is not a valid path.
     */
    public static Optional<FieldPath> tryParse(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = text.split("\\.", -1);
        Optional<Container> container = Container.fromRoot(parts[0]);
        if (container.isEmpty()) {
            return Optional.empty();
        }
        if (parts.length < container.get().minSegments || parts.length > container.get().maxSegments) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (part.isEmpty() || part.chars().anyMatch(Character::isWhitespace)) {
                return Optional.empty();
            }
        }
        return Optional.of(new FieldPath(container.get(), List.of(parts), text));
    }

    /**
     * @param text Path text.
     * @return the parsed path.
     * @throws UnknownPathException if the text is not a valid path.
     */
    public static FieldPath parse(String text) {
        return tryParse(text).orElseThrow(() -> new UnknownPathException("Invalid field path: '" + text + "'"));
    }

    /**
     * @return true if the text is syntactically a field path.
     */
    public static boolean isPath(String text) {
        return tryParse(text).isPresent();
    }

    /**
     * @return the segment after the root: agent id, environment field, metric name or event type.
     */
    public String key() {
        return segments.get(1);
    }

    /**
     * @return the third segment (agent field or event payload key), or null.
     */
    public String field() {
        return segments.size() > 2 ? segments.get(2) : null;
    }

    @Override
    public String toString() {
        return raw;
    }
}
