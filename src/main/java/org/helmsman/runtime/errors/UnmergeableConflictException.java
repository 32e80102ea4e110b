package org.helmsman.runtime.errors;

/**
 * Thrown when the MERGE strategy has no merge policy for the conflicting writes. The conflict resolver catches it and falls back to PRIORITY.
 */
public class UnmergeableConflictException extends EngineException {

    public UnmergeableConflictException(String message) {
        super(message);
    }

    public UnmergeableConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNMERGEABLE_CONFLICT;
    }
}
