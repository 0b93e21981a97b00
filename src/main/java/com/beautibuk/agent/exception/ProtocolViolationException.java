package com.beautibuk.agent.exception;

/**
 * Conversation bookkeeping is broken: an orphan tool result, a duplicated call id,
 * a response correlated to the wrong request.
 */
public class ProtocolViolationException extends AgentException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
