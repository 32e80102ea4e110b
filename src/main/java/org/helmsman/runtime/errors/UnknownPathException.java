package org.helmsman.runtime.errors;

/**
 * Thrown when a field path does not parse or names an agent, field or metric that does not exist.
 */
public class UnknownPathException extends EngineException {

    public UnknownPathException(String message) {
        super(message);
    }

    public UnknownPathException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNKNOWN_PATH;
    }
}
