package com.beautibuk.agent.exception;

import lombok.Getter;

/**
 * A tool name that is not in the current catalog. Raised client-side; never sent to the server.
 */
@Getter
public class UnknownToolException extends ProtocolViolationException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool '" + toolName + "'");
        this.toolName = toolName;
    }
}
