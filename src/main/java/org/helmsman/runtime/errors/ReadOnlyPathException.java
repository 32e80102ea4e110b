package org.helmsman.runtime.errors;

/**
 * Thrown when a write targets {@code events.*} or an agent identifier.
 */
public class ReadOnlyPathException extends EngineException {

    public ReadOnlyPathException(String message) {
        super(message);
    }

    public ReadOnlyPathException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.READ_ONLY_PATH;
    }
}
