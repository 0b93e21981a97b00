package com.beautibuk.agent.core;

import com.beautibuk.agent.config.AgentProperties;
import com.beautibuk.agent.exception.AgentException;
import com.beautibuk.agent.exception.ProtocolViolationException;
import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.beautibuk.agent.exception.StorageFailureException;
import com.beautibuk.agent.exception.ToolUnavailableException;
import com.beautibuk.agent.exception.TurnDeadlineExceededException;
import com.beautibuk.agent.exception.UnknownToolException;
import com.beautibuk.agent.llm.LlmClient;
import com.beautibuk.agent.model.LlmResponse;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.model.ToolCall;
import com.beautibuk.agent.rag.RagRetriever;
import com.beautibuk.agent.rag.RetrievalResult;
import com.beautibuk.agent.session.Session;
import com.beautibuk.agent.session.SessionStore;
import com.beautibuk.agent.session.ToolCallLedger;
import com.beautibuk.agent.tool.ToolDefinition;
import com.beautibuk.agent.tool.ToolRegistryClient;
import com.beautibuk.agent.tool.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tool-calling orchestration loop.
 *
 * Per-turn flow:
 * 1. Load or create the session
 * 2. Retrieve similar past messages (optional RAG context)
 * 3. Fetch the tool catalog
 * 4. Loop: completion → tool calls → tool results → completion, bounded by
 *    agent.loop.max-tool-rounds and agent.loop.turn-timeout
 * 5. Store the user message's embedding, then append the turn to the session
 *
 * The loop is an explicit state machine over {@link TurnState}; it never recurses.
 * Only {@link StorageFailureException} escapes a turn. The round bound and the time budget
 * commit the consistent part of the turn with a fallback reply; any other failure becomes a
 * degraded {@link TurnOutcome} with nothing committed.
 */
@Service
@Slf4j
public class Orchestrator {

    static final String ROUND_LIMIT_REPLY =
            "I was unable to complete this request after several attempts.";
    static final String TIMEOUT_REPLY =
            "I could not finish this request in time. Please try again.";
    static final String PROVIDER_UNAVAILABLE_REPLY =
            "The assistant is temporarily unavailable. Please try again in a moment.";
    static final String TOOLS_UNAVAILABLE_REPLY =
            "I can't reach the booking services right now. Please try again shortly.";
    static final String PROTOCOL_VIOLATION_REPLY =
            "Something went wrong while processing your request. Please try again.";

    private final LlmClient llmClient;
    private final ToolRegistryClient toolRegistryClient;
    private final SessionStore sessionStore;
    private final RagRetriever ragRetriever;
    private final AgentProperties.Loop loop;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Orchestrator(LlmClient llmClient,
                        ToolRegistryClient toolRegistryClient,
                        SessionStore sessionStore,
                        @Nullable RagRetriever ragRetriever,
                        AgentProperties properties,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.llmClient = llmClient;
        this.toolRegistryClient = toolRegistryClient;
        this.sessionStore = sessionStore;
        this.ragRetriever = ragRetriever;
        this.loop = properties.getLoop();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs one turn for {@code userText} in session {@code sessionId}.
     *
     * @throws StorageFailureException if the session or similarity store fails; the exception
     *         carries the turn's messages so the caller can retry the write
     */
    public TurnOutcome handle(String sessionId, String userText) {
        log.info("Turn started [sessionId={}, input length={}]", sessionId, userText.length());

        TurnContext ctx = start(sessionId, userText);

        try {
            ctx.setCatalog(toolRegistryClient.listTools());
            ctx.setState(TurnState.AWAITING_COMPLETION);
            return run(ctx);

        } catch (StorageFailureException e) {
            throw e;
        } catch (TurnDeadlineExceededException e) {
            log.warn("Turn time budget of {} exceeded during completion retries [sessionId={}, rounds={}]",
                    loop.getTurnTimeout(), sessionId, ctx.getToolRounds());
            return terminateEarly(ctx, TurnOutcome.Status.TIMED_OUT, TIMEOUT_REPLY);
        } catch (ProviderUnavailableException e) {
            log.error("Completion provider unavailable [sessionId={}]: {}", sessionId, e.getMessage());
            return degraded(ctx, TurnOutcome.Status.PROVIDER_UNAVAILABLE, PROVIDER_UNAVAILABLE_REPLY);
        } catch (ToolUnavailableException e) {
            log.error("Tool catalog unavailable [sessionId={}]: {}", sessionId, e.getMessage());
            return degraded(ctx, TurnOutcome.Status.TOOLS_UNAVAILABLE, TOOLS_UNAVAILABLE_REPLY);
        } catch (ProtocolViolationException e) {
            log.error("Protocol violation, turn aborted [sessionId={}, state={}]: {}",
                    sessionId, ctx.getState(), e.getMessage());
            return degraded(ctx, TurnOutcome.Status.PROTOCOL_VIOLATION, PROTOCOL_VIOLATION_REPLY);
        } catch (AgentException e) {
            // Non-retryable provider errors such as a rejected API key
            log.error("Turn failed [sessionId={}, state={}]", sessionId, ctx.getState(), e);
            return degraded(ctx, TurnOutcome.Status.PROVIDER_UNAVAILABLE, PROVIDER_UNAVAILABLE_REPLY);
        } catch (RuntimeException e) {
            log.error("Unexpected failure, turn aborted [sessionId={}, state={}]", sessionId, ctx.getState(), e);
            return degraded(ctx, TurnOutcome.Status.PROTOCOL_VIOLATION, PROTOCOL_VIOLATION_REPLY);
        }
    }

    // ─── States ─────────────────────────────────────────────────────────────

    private TurnContext start(String sessionId, String userText) {
        Session session;
        try {
            session = sessionStore.loadOrCreate(sessionId);
        } catch (StorageFailureException e) {
            throw e.withTurn(sessionId, List.of(Message.user(userText)));
        }

        TurnContext ctx = TurnContext.builder()
                .sessionId(sessionId)
                .userText(userText)
                .history(session.getMessages() != null ? session.getMessages() : List.of())
                .deadline(clock.instant().plus(loop.getTurnTimeout()))
                .build();

        if (ragRetriever != null) {
            RetrievalResult retrieval;
            try {
                retrieval = ragRetriever.retrieve(userText);
            } catch (StorageFailureException e) {
                throw e.withTurn(sessionId, List.of(Message.user(userText)));
            }
            ctx.setQueryVector(retrieval.queryVector());
            RagRetriever.buildContextMessage(retrieval.snippets()).ifPresent(ctx::setContextMessage);
            log.debug("RAG context: {} snippet(s) [sessionId={}]", retrieval.snippets().size(), sessionId);
        }

        ctx.getTurnMessages().add(Message.user(userText));
        return ctx;
    }

    private TurnOutcome run(TurnContext ctx) {
        while (ctx.getState() != TurnState.DONE) {
            if (deadlinePassed(ctx)) {
                log.warn("Turn time budget of {} exceeded [sessionId={}, state={}, rounds={}]",
                        loop.getTurnTimeout(), ctx.getSessionId(), ctx.getState(), ctx.getToolRounds());
                return terminateEarly(ctx, TurnOutcome.Status.TIMED_OUT, TIMEOUT_REPLY);
            }

            switch (ctx.getState()) {
                case AWAITING_COMPLETION -> {
                    LlmResponse response = llmClient.chat(buildPrompt(ctx), ctx.getCatalog(), ctx.getDeadline());

                    if (!response.isToolCallRequired()) {
                        return finish(ctx, response.getContent());
                    }
                    if (ctx.getToolRounds() >= loop.getMaxToolRounds()) {
                        log.warn("Tool round bound ({}) reached [sessionId={}]",
                                loop.getMaxToolRounds(), ctx.getSessionId());
                        return terminateEarly(ctx, TurnOutcome.Status.ROUND_LIMIT_REACHED, ROUND_LIMIT_REPLY);
                    }

                    validateToolRequest(ctx, response.getToolCalls());
                    ctx.getTurnMessages().add(Message.toolRequest(response.getContent(), response.getToolCalls()));
                    ctx.setPendingCalls(new ArrayList<>(response.getToolCalls()));
                    ctx.setState(TurnState.EXECUTING_TOOLS);
                }
                case EXECUTING_TOOLS -> {
                    if (ctx.getPendingCalls().isEmpty()) {
                        ctx.setToolRounds(ctx.getToolRounds() + 1);
                        ctx.setState(TurnState.AWAITING_COMPLETION);
                    } else {
                        executeTool(ctx, ctx.getPendingCalls().remove(0));
                    }
                }
                default -> throw new IllegalStateException("Unexpected turn state " + ctx.getState());
            }
        }
        throw new IllegalStateException("Turn loop exited without an outcome");
    }

    private void executeTool(TurnContext ctx, ToolCall call) {
        log.info("Executing tool [{}] id={} [sessionId={}, round={}]",
                call.getToolName(), call.getId(), ctx.getSessionId(), ctx.getToolRounds() + 1);

        ToolResult result = toolRegistryClient.callTool(call.getToolName(), call.getArguments());
        ctx.setToolCallsExecuted(ctx.getToolCallsExecuted() + 1);

        if (!result.isSuccess()) {
            log.warn("Tool [{}] returned {} [sessionId={}]: {}",
                    call.getToolName(), result.getStatus(), ctx.getSessionId(), result.getErrorMessage());
        }
        ctx.getTurnMessages().add(Message.toolResult(call, toolResultContent(result)));
    }

    /**
     * Rejects a tool request the loop cannot answer faithfully: an unknown tool name,
     * a missing call id, or a call id already used in this turn.
     */
    private void validateToolRequest(TurnContext ctx, List<ToolCall> calls) {
        Set<String> catalogNames = ctx.getCatalog().stream()
                .map(ToolDefinition::getName)
                .collect(Collectors.toSet());

        for (ToolCall call : calls) {
            if (!catalogNames.contains(call.getToolName())) {
                throw new UnknownToolException(call.getToolName());
            }
            if (call.getId() == null || call.getId().isBlank()) {
                throw new ProtocolViolationException("Tool call '" + call.getToolName() + "' has no call id");
            }
            if (!ctx.getSeenCallIds().add(call.getId())) {
                throw new ProtocolViolationException("Model reused tool call id '" + call.getId() + "'");
            }
        }
    }

    // ─── Outcomes ───────────────────────────────────────────────────────────

    private TurnOutcome finish(TurnContext ctx, String content) {
        if (content == null || content.isBlank()) {
            throw new ProtocolViolationException("Completion carried neither content nor tool calls");
        }
        ctx.getTurnMessages().add(Message.assistant(content));
        return commit(ctx, TurnOutcome.Status.COMPLETED, content);
    }

    /**
     * Round bound or time budget: keep the consistent part of the turn, drop any tool request
     * whose results are incomplete, and close the turn with a fallback reply.
     */
    private TurnOutcome terminateEarly(TurnContext ctx, TurnOutcome.Status status, String reply) {
        List<Message> turn = ctx.getTurnMessages();
        int consistent = ToolCallLedger.consistentPrefixLength(turn);
        if (consistent < turn.size()) {
            log.debug("Dropping {} message(s) of an unanswered tool request [sessionId={}]",
                    turn.size() - consistent, ctx.getSessionId());
            turn.subList(consistent, turn.size()).clear();
        }
        turn.add(Message.assistant(reply));
        return commit(ctx, status, reply);
    }

    private TurnOutcome commit(TurnContext ctx, TurnOutcome.Status status, String reply) {
        ctx.setState(TurnState.DONE);
        List<Message> turn = List.copyOf(ctx.getTurnMessages());

        try {
            if (ragRetriever != null && ctx.getQueryVector() != null) {
                ragRetriever.remember(ctx.getSessionId(), ctx.getUserText(), ctx.getQueryVector());
            }
            sessionStore.append(ctx.getSessionId(), turn);
        } catch (StorageFailureException e) {
            log.error("Failed to persist turn [sessionId={}, messages={}]", ctx.getSessionId(), turn.size(), e);
            throw e.withTurn(ctx.getSessionId(), turn);
        }

        log.info("Turn complete [sessionId={}, status={}, rounds={}, toolCalls={}, messages={}]",
                ctx.getSessionId(), status, ctx.getToolRounds(), ctx.getToolCallsExecuted(), turn.size());

        return outcome(ctx, status, reply);
    }

    private TurnOutcome degraded(TurnContext ctx, TurnOutcome.Status status, String reply) {
        log.warn("Turn degraded, nothing committed [sessionId={}, status={}]", ctx.getSessionId(), status);
        return outcome(ctx, status, reply);
    }

    private TurnOutcome outcome(TurnContext ctx, TurnOutcome.Status status, String reply) {
        return TurnOutcome.builder()
                .sessionId(ctx.getSessionId())
                .response(reply)
                .status(status)
                .toolRounds(ctx.getToolRounds())
                .toolCallsExecuted(ctx.getToolCallsExecuted())
                .build();
    }

    // ─── Helpers ────────────────────────────────────────────────────────────

    private List<Message> buildPrompt(TurnContext ctx) {
        List<Message> window = ContextWindow.trim(ctx.conversation(), loop.getMaxContextMessages());
        List<Message> prompt = new ArrayList<>(window.size() + 1);
        if (ctx.getContextMessage() != null) {
            prompt.add(ctx.getContextMessage());
        }
        prompt.addAll(window);
        return prompt;
    }

    private boolean deadlinePassed(TurnContext ctx) {
        return clock.instant().isAfter(ctx.getDeadline());
    }

    /**
     * Successful output verbatim; failures as a JSON error object the model can read,
     * e.g. {"error":{"kind":"ToolExecutionFailed","code":404,"message":"no results"}}.
     */
    String toolResultContent(ToolResult result) {
        if (result.isSuccess()) {
            return result.getText();
        }

        Map<String, Object> error = new LinkedHashMap<>();
        if (result.getStatus() == ToolResult.Status.EXECUTION_FAILED) {
            error.put("kind", "ToolExecutionFailed");
            error.put("code", result.getErrorCode());
        } else {
            error.put("kind", "ToolUnavailable");
        }
        error.put("message", result.getErrorMessage() != null ? result.getErrorMessage() : "");

        try {
            return objectMapper.writeValueAsString(Map.of("error", error));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize tool error", e);
        }
    }
}
