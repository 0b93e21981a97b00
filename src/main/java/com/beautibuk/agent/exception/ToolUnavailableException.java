package com.beautibuk.agent.exception;

/**
 * Tool server could not be reached, or the tool listing failed.
 */
public class ToolUnavailableException extends AgentException {

    public ToolUnavailableException(String message) {
        super(message);
    }

    public ToolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
