package com.beautibuk.agent.core;

import com.beautibuk.agent.model.ChatResponse;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one orchestration turn. {@code response} is never empty.
 */
@Value
@Builder
public class TurnOutcome {

    public enum Status {
        /** The model produced a final answer */
        COMPLETED,
        /** The tool-round bound was reached; fallback reply, session persisted */
        ROUND_LIMIT_REACHED,
        /** The turn's wall-clock budget ran out; fallback reply, session persisted */
        TIMED_OUT,
        /** Completion provider unreachable after retries; nothing committed */
        PROVIDER_UNAVAILABLE,
        /** Tool catalog could not be fetched; nothing committed */
        TOOLS_UNAVAILABLE,
        /** Malformed exchange with the model or tool server; nothing committed */
        PROTOCOL_VIOLATION
    }

    String sessionId;
    String response;
    Status status;
    int toolRounds;
    int toolCallsExecuted;

    public boolean isCommitted() {
        return status == Status.COMPLETED
                || status == Status.ROUND_LIMIT_REACHED
                || status == Status.TIMED_OUT;
    }

    public ChatResponse toChatResponse() {
        return new ChatResponse(response, sessionId);
    }
}
