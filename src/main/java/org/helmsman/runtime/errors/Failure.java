package org.helmsman.runtime.errors;

/**
 * Value form of an {@link EngineException}, as stored in explanations and reports.
 * <p>
 * Exceptions are not comparable, so recorded failures carry only their kind and message. This keeps
 * snapshots of two identical runs equal.
 *
 * @param kind The failure classification.
 * @param message The failure message.
 */
public record Failure(ErrorKind kind, String message) {

    public static Failure of(EngineException e) {
        return new Failure(e.kind(), e.getMessage());
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
