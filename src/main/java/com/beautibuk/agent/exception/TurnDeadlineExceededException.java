package com.beautibuk.agent.exception;

/**
 * The turn's time budget ran out before another provider attempt could start.
 * Never retried.
 */
public class TurnDeadlineExceededException extends AgentException {

    public TurnDeadlineExceededException(String message) {
        super(message);
    }
}
