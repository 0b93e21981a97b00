package com.beautibuk.agent.llm;

import com.beautibuk.agent.model.LlmResponse;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.tool.ToolDefinition;

import java.time.Instant;
import java.util.List;

/**
 * Capability interface over a completion provider. Vendor wire formats live in the adapters.
 */
public interface LlmClient {

    /**
     * Send the full conversation and the available tool schemas to the LLM.
     *
     * @param messages  full prompt (optional RAG system message + history + this turn so far)
     * @param tools     tool definitions the LLM can choose to invoke; may be empty
     * @return either a final text answer or an ordered list of tool calls
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);

    /**
     * Same as {@link #chat(List, List)}, bounded by the turn's deadline. Clients that retry must not
     * start an attempt after {@code deadline}; single-shot adapters rely on their HTTP timeouts.
     *
     * @throws com.beautibuk.agent.exception.TurnDeadlineExceededException if no attempt could start in time
     */
    default LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, Instant deadline) {
        return chat(messages, tools);
    }
}
