package org.helmsman.runtime.errors;

/**
 * Thrown when an action lacks a field its type requires (a CLAMP without bounds, a SET without value, ...).
 */
public class InvalidActionException extends EngineException {

    public InvalidActionException(String message) {
        super(message);
    }

    public InvalidActionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_ACTION;
    }
}
