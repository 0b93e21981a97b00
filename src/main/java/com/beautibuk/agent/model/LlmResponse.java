package com.beautibuk.agent.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class LlmResponse {

    /** Final text answer, or optional preamble text accompanying tool calls */
    private String content;

    /** Non-empty when the LLM wants to invoke one or more tools */
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean isToolCallRequired() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
