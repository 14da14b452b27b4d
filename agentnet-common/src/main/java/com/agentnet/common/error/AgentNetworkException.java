package com.agentnet.common.error;

import lombok.Getter;

/**
 * Domain failure raised by the registry, scheduler and adapters.
 * The {@link ErrorKind} lets callers map a failure onto a result object.
 */
@Getter
public class AgentNetworkException extends RuntimeException {

    private final ErrorKind kind;

    public AgentNetworkException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public AgentNetworkException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    // =========================================================================
    // Kind enum
    // =========================================================================

    public enum ErrorKind {
        NOT_FOUND,
        VALIDATION_ERROR,
        CYCLIC_DEPENDENCY,
        NO_AGENTS_AVAILABLE,
        EXECUTION_FAILURE,
        INTEGRATION_UNAVAILABLE
    }

    public static AgentNetworkException notFound(String message) {
        return new AgentNetworkException(ErrorKind.NOT_FOUND, message);
    }

    public static AgentNetworkException validation(String message) {
        return new AgentNetworkException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static AgentNetworkException noAgents(String message) {
        return new AgentNetworkException(ErrorKind.NO_AGENTS_AVAILABLE, message);
    }

    public static AgentNetworkException unavailable(String message) {
        return new AgentNetworkException(ErrorKind.INTEGRATION_UNAVAILABLE, message);
    }

    public static AgentNetworkException executionFailure(String message, Throwable cause) {
        return new AgentNetworkException(ErrorKind.EXECUTION_FAILURE, message, cause);
    }

    /**
     * Kind of an arbitrary throwable; anything that is not an
     * {@code AgentNetworkException} counts as an execution failure.
     */
    public static ErrorKind kindOf(Throwable err) {
        return err instanceof AgentNetworkException ane ? ane.getKind() : ErrorKind.EXECUTION_FAILURE;
    }
}
