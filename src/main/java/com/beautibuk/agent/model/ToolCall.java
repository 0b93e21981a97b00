package com.beautibuk.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A tool invocation requested by the model.
 * Arguments are an opaque key/value tree; only the remote tool server interprets them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Unique within one completion turn; echoed back on the tool-result message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}
