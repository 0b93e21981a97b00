package com.beautibuk.agent.exception;

/**
 * Root of every failure the agent maps before it reaches the chat boundary.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
