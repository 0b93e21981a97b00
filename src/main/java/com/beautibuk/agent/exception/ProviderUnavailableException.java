package com.beautibuk.agent.exception;

/**
 * Completion or embedding provider unreachable, timed out, or returned a payload we could not read.
 * Retryable.
 */
public class ProviderUnavailableException extends AgentException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
