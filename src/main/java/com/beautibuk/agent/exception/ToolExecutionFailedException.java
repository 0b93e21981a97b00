package com.beautibuk.agent.exception;

import lombok.Getter;

/**
 * Well-formed error answered by the tool server. Never fatal for a turn:
 * the orchestrator hands it back to the model as a tool result.
 */
@Getter
public class ToolExecutionFailedException extends AgentException {

    private final int code;
    private final String remoteMessage;

    public ToolExecutionFailedException(int code, String remoteMessage) {
        super("Tool execution failed [" + code + "]: " + remoteMessage);
        this.code = code;
        this.remoteMessage = remoteMessage;
    }
}
