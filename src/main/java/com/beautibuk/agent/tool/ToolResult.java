package com.beautibuk.agent.tool;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one remote tool call: either the text payload or a structured error.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ToolResult {

    public enum Status { SUCCESS, EXECUTION_FAILED, UNAVAILABLE }

    Status status;
    String text;
    Integer errorCode;
    String errorMessage;

    public static ToolResult success(String text) {
        return new ToolResult(Status.SUCCESS, text, null, null);
    }

    public static ToolResult executionFailed(int code, String message) {
        return new ToolResult(Status.EXECUTION_FAILED, null, code, message);
    }

    public static ToolResult unavailable(String message) {
        return new ToolResult(Status.UNAVAILABLE, null, null, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
