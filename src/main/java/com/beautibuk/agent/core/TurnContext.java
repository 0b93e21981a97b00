package com.beautibuk.agent.core;

import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.model.ToolCall;
import com.beautibuk.agent.tool.ToolDefinition;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Holds all mutable state for a single orchestration turn.
 * Passed through the state machine instead of scattered fields on Orchestrator.
 */
@Data
@Builder
public class TurnContext {

    private String sessionId;
    private String userText;

    /** Stored history as loaded at the start of the turn */
    private List<Message> history;

    /** RAG system message; null when retrieval found nothing */
    private Message contextMessage;

    /** Embedding of {@link #userText}; null when the embedding provider was unavailable */
    private float[] queryVector;

    private List<ToolDefinition> catalog;

    /** Messages produced by this turn, in order, starting with the user message */
    @Builder.Default
    private List<Message> turnMessages = new ArrayList<>();

    /** Calls of the latest tool request, awaiting execution */
    @Builder.Default
    private List<ToolCall> pendingCalls = new ArrayList<>();

    /** Call ids seen in this turn; a model reusing one breaks result correlation */
    @Builder.Default
    private Set<String> seenCallIds = new HashSet<>();

    @Builder.Default
    private TurnState state = TurnState.START;

    private int toolRounds;
    private int toolCallsExecuted;
    private Instant deadline;

    /** History followed by this turn's messages */
    public List<Message> conversation() {
        List<Message> all = new ArrayList<>(history.size() + turnMessages.size());
        all.addAll(history);
        all.addAll(turnMessages);
        return all;
    }
}
