package org.helmsman.runtime.errors;

/**
 * Thrown when a write targets an agent that was not declared in the initial state. Rules never create agents.
 */
public class UnknownAgentException extends EngineException {

    public UnknownAgentException(String message) {
        super(message);
    }

    public UnknownAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNKNOWN_AGENT;
    }
}
