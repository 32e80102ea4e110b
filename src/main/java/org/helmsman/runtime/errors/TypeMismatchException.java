package org.helmsman.runtime.errors;

/**
 * Thrown when an operator or action receives a value of the wrong type, e.g. a text field used with {@code <}.
 */
public class TypeMismatchException extends EngineException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TYPE_MISMATCH;
    }
}
