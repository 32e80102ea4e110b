package org.helmsman.runtime.errors;

/**
 * Base class for all failures raised while evaluating or applying a rule.
 * <p>
 * The decision engine never lets these escape a tick. A failure aborts the remaining actions of
 * the rule that raised it and is recorded on that rule's explanation, so that every error stays
 * visible to the explanation layer instead of crashing the simulation.
 * <p>
 * This is a RuntimeException because the failures are data-driven (a rule refers to a path that
 * does not exist, compares text with a number, ...) and are handled at one place in the engine.
 */
public abstract class EngineException extends RuntimeException {

    /**
     * Creates an EngineException with the specified message.
     *
     * @param message Description of the failure
     */
    protected EngineException(String message) {
        super(message);
    }

    /**
     * Creates an EngineException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the classification of this failure.
     */
    public abstract ErrorKind kind();
}
