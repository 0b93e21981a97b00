package com.beautibuk.agent.core;

import com.beautibuk.agent.config.AgentProperties;
import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.beautibuk.agent.exception.StorageFailureException;
import com.beautibuk.agent.exception.ToolUnavailableException;
import com.beautibuk.agent.exception.TurnDeadlineExceededException;
import com.beautibuk.agent.llm.LlmClient;
import com.beautibuk.agent.model.LlmResponse;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.model.ToolCall;
import com.beautibuk.agent.rag.EmbeddingRecord;
import com.beautibuk.agent.rag.EmbeddingService;
import com.beautibuk.agent.rag.InMemorySimilarityStore;
import com.beautibuk.agent.rag.RagRetriever;
import com.beautibuk.agent.session.InMemorySessionStore;
import com.beautibuk.agent.session.Session;
import com.beautibuk.agent.session.SessionStore;
import com.beautibuk.agent.tool.ToolDefinition;
import com.beautibuk.agent.tool.ToolRegistryClient;
import com.beautibuk.agent.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrchestratorTest {

    private static final String SESSION = "session-1";
    private static final ToolDefinition SEARCH_BUSINESSES = ToolDefinition.builder()
            .name("search_businesses")
            .description("Search beauty businesses by service and city")
            .inputSchema(Map.of("type", "object"))
            .build();
    private static final ToolDefinition LIST_SERVICES = ToolDefinition.builder()
            .name("list_services")
            .description("Services offered by a business")
            .inputSchema(Map.of("type", "object"))
            .build();

    @Mock LlmClient llmClient;
    @Mock ToolRegistryClient toolRegistryClient;
    @Mock EmbeddingService embeddingService;

    private MutableClock clock;
    private AgentProperties properties;
    private InMemorySessionStore sessionStore;
    private InMemorySimilarityStore similarityStore;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        properties = new AgentProperties();
        sessionStore = new InMemorySessionStore(clock);
        similarityStore = new InMemorySimilarityStore(3);
        orchestrator = orchestrator(sessionStore, properties);

        lenient().when(embeddingService.embed(anyString())).thenReturn(new float[]{1f, 0f, 0f});
        lenient().when(toolRegistryClient.listTools()).thenReturn(List.of(SEARCH_BUSINESSES, LIST_SERVICES));
    }

    // ─── Scenarios ──────────────────────────────────────────────────────────

    @Test
    void handle_toolCallThenFinalAnswer_persistsFourMessagesAndOneEmbedding() {
        ToolCall search = call("call_1", "search_businesses", Map.of("query", "haircut", "city", "Athens"));
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(toolRequest(search))
                .thenReturn(answer("I found 2 salons in Athens."));
        when(toolRegistryClient.callTool("search_businesses", Map.of("query", "haircut", "city", "Athens")))
                .thenReturn(ToolResult.success("[{\"name\":\"Salon Alpha\"},{\"name\":\"Salon Beta\"}]"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Find me a salon for a haircut in Athens");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.COMPLETED);
        assertThat(outcome.getResponse()).isEqualTo("I found 2 salons in Athens.");
        assertThat(outcome.getSessionId()).isEqualTo(SESSION);

        List<Message> stored = sessionStore.loadOrCreate(SESSION).getMessages();
        assertThat(stored).extracting(Message::getRole).containsExactly(
                Message.Role.user, Message.Role.assistant, Message.Role.tool, Message.Role.assistant);
        assertThat(stored.get(1).getToolCalls()).containsExactly(search);
        assertThat(stored.get(2).getToolCallId()).isEqualTo("call_1");
        assertThat(stored.get(2).getContent()).contains("Salon Alpha");

        assertThat(similarityStore.queryNearest(new float[]{1f, 0f, 0f}, 10))
                .singleElement()
                .satisfies(hit -> {
                    assertThat(hit.record().getText()).isEqualTo("Find me a salon for a haircut in Athens");
                    assertThat(hit.record().getOwnerId()).isEqualTo(SESSION);
                });
    }

    @Test
    void handle_toolExecutionFailed_feedsErrorBackAndContinues() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(toolRequest(call("call_1", "search_businesses", Map.of("query", "nails"))))
                .thenReturn(answer("Sorry, I couldn't find any nail salons."));
        when(toolRegistryClient.callTool(eq("search_businesses"), anyMap()))
                .thenReturn(ToolResult.executionFailed(404, "no results"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Any nail salons?");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.COMPLETED);
        assertThat(outcome.getResponse()).isEqualTo("Sorry, I couldn't find any nail salons.");

        Message toolResult = sessionStore.loadOrCreate(SESSION).getMessages().get(2);
        assertThat(toolResult.getRole()).isEqualTo(Message.Role.tool);
        assertThat(toolResult.getContent())
                .isEqualTo("{\"error\":{\"kind\":\"ToolExecutionFailed\",\"code\":404,\"message\":\"no results\"}}");
        verify(llmClient, times(2)).chat(anyList(), anyList(), any(Instant.class));
    }

    @Test
    void handle_unknownToolName_abortsWithoutCommitting() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(toolRequest(call("call_1", "delete_all_bookings", Map.of())));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Cancel everything");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.PROTOCOL_VIOLATION);
        assertThat(outcome.getResponse()).isEqualTo(Orchestrator.PROTOCOL_VIOLATION_REPLY);
        assertThat(outcome.isCommitted()).isFalse();
        verify(toolRegistryClient, never()).callTool(anyString(), any());
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).isEmpty();
        assertThat(similarityStore.queryNearest(new float[]{1f, 0f, 0f}, 10)).isEmpty();
    }

    @Test
    void handle_roundBoundTwo_forcesFallbackAfterExactlyTwoRounds() {
        properties.getLoop().setMaxToolRounds(2);
        AtomicInteger ids = new AtomicInteger();
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenAnswer(inv ->
                toolRequest(call("call_" + ids.incrementAndGet(), "search_businesses", Map.of("query", "spa"))));
        when(toolRegistryClient.callTool(eq("search_businesses"), anyMap()))
                .thenReturn(ToolResult.success("[]"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Find a spa");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.ROUND_LIMIT_REACHED);
        assertThat(outcome.getResponse()).isNotBlank().isEqualTo(Orchestrator.ROUND_LIMIT_REPLY);
        assertThat(outcome.getToolRounds()).isEqualTo(2);
        verify(toolRegistryClient, times(2)).callTool(anyString(), anyMap());

        List<Message> stored = sessionStore.loadOrCreate(SESSION).getMessages();
        assertThat(stored).extracting(Message::getRole).containsExactly(
                Message.Role.user,
                Message.Role.assistant, Message.Role.tool,
                Message.Role.assistant, Message.Role.tool,
                Message.Role.assistant);
        assertThat(stored.get(5).getContent()).isEqualTo(Orchestrator.ROUND_LIMIT_REPLY);
        assertThat(stored.get(5).requestsTools()).isFalse();
    }

    // ─── Protocol bookkeeping ───────────────────────────────────────────────

    @Test
    void handle_severalCallsInOneRequest_eachAnsweredExactlyOnceInOrder() {
        ToolCall first = call("call_a", "search_businesses", Map.of("query", "barber"));
        ToolCall second = call("call_b", "list_services", Map.of("business_id", 7));
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(toolRequest(first, second))
                .thenReturn(answer("Barber Joe offers fades and beard trims."));
        when(toolRegistryClient.callTool(eq("search_businesses"), anyMap())).thenReturn(ToolResult.success("[7]"));
        when(toolRegistryClient.callTool(eq("list_services"), anyMap())).thenReturn(ToolResult.success("fade, beard"));

        orchestrator.handle(SESSION, "What does the nearest barber offer?");

        List<Message> stored = sessionStore.loadOrCreate(SESSION).getMessages();
        Message request = stored.get(1);
        List<Message> results = stored.subList(2, 4);

        assertThat(results).hasSize(request.getToolCalls().size());
        assertThat(results).extracting(Message::getToolCallId).containsExactly("call_a", "call_b");
        assertThat(results).extracting(Message::getName).containsExactly("search_businesses", "list_services");
    }

    @Test
    void handle_modelReusesCallId_isProtocolViolation() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(toolRequest(call("call_1", "search_businesses", Map.of())))
                .thenReturn(toolRequest(call("call_1", "search_businesses", Map.of())));
        when(toolRegistryClient.callTool(eq("search_businesses"), anyMap())).thenReturn(ToolResult.success("[]"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Find something");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.PROTOCOL_VIOLATION);
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).isEmpty();
    }

    @Test
    void handle_completionWithNeitherContentNorTools_isProtocolViolation() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer(""));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Hello?");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.PROTOCOL_VIOLATION);
        assertThat(outcome.getResponse()).isNotBlank();
    }

    // ─── Degraded paths ─────────────────────────────────────────────────────

    @Test
    void handle_providerUnavailable_returnsDegradedMessageAndCommitsNothing() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenThrow(new ProviderUnavailableException("groq server error [503]"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Book me a massage");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.PROVIDER_UNAVAILABLE);
        assertThat(outcome.getResponse()).isEqualTo(Orchestrator.PROVIDER_UNAVAILABLE_REPLY);
        assertThat(outcome.getSessionId()).isEqualTo(SESSION);
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).isEmpty();
    }

    @Test
    void handle_unexpectedRuntimeFailure_returnsStructuredReplyWithSessionIdAndCommitsNothing() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenThrow(new IllegalArgumentException("Cannot deserialize Map from Array value"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Book me a massage");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.PROTOCOL_VIOLATION);
        assertThat(outcome.getResponse()).isEqualTo(Orchestrator.PROTOCOL_VIOLATION_REPLY);
        assertThat(outcome.getSessionId()).isEqualTo(SESSION);
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).isEmpty();
    }

    @Test
    void handle_toolCatalogUnavailable_abortsBeforeAnyCompletion() {
        when(toolRegistryClient.listTools()).thenThrow(new ToolUnavailableException("Tool server unreachable"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Find me a salon");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.TOOLS_UNAVAILABLE);
        assertThat(outcome.getResponse()).isEqualTo(Orchestrator.TOOLS_UNAVAILABLE_REPLY);
        verifyNoInteractions(llmClient);
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).isEmpty();
    }

    @Test
    void handle_timeBudgetExceeded_persistsConsistentPrefixWithFallback() {
        properties.getLoop().setTurnTimeout(Duration.ofSeconds(10));
        AtomicInteger ids = new AtomicInteger();
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(6));
            return toolRequest(call("call_" + ids.incrementAndGet(), "search_businesses", Map.of()));
        });
        when(toolRegistryClient.callTool(eq("search_businesses"), anyMap())).thenReturn(ToolResult.success("[]"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Find anything");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.TIMED_OUT);
        assertThat(outcome.getResponse()).isEqualTo(Orchestrator.TIMEOUT_REPLY);
        verify(toolRegistryClient, times(1)).callTool(anyString(), anyMap());

        List<Message> stored = sessionStore.loadOrCreate(SESSION).getMessages();
        assertThat(stored).extracting(Message::getRole).containsExactly(
                Message.Role.user, Message.Role.assistant, Message.Role.tool, Message.Role.assistant);
        assertThat(stored.get(1).getToolCalls()).extracting(ToolCall::getId).containsExactly("call_1");
    }

    @Test
    void handle_deadlinePassesDuringCompletionRetries_timesOutWithConsistentPrefix() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(toolRequest(call("call_1", "search_businesses", Map.of())))
                .thenThrow(new TurnDeadlineExceededException("Turn deadline passed before completion attempt"));
        when(toolRegistryClient.callTool(eq("search_businesses"), anyMap())).thenReturn(ToolResult.success("[]"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Find anything");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.TIMED_OUT);
        assertThat(outcome.getResponse()).isEqualTo(Orchestrator.TIMEOUT_REPLY);
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).extracting(Message::getRole).containsExactly(
                Message.Role.user, Message.Role.assistant, Message.Role.tool, Message.Role.assistant);
    }

    @Test
    void handle_completionGetsTurnDeadline() {
        properties.getLoop().setTurnTimeout(Duration.ofSeconds(30));
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer("Hi!"));

        orchestrator.handle(SESSION, "Hello");

        verify(llmClient).chat(anyList(), anyList(), eq(clock.instant().plusSeconds(30)));
    }

    @Test
    void handle_storageFailureOnAppend_propagatesWithPendingTurn() {
        SessionStore failingStore = mock(SessionStore.class);
        when(failingStore.loadOrCreate(SESSION)).thenReturn(Session.empty(SESSION, clock.instant()));
        doThrow(new StorageFailureException("Mongo down", new RuntimeException("timeout")))
                .when(failingStore).append(eq(SESSION), anyList());
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer("Hi there!"));

        Orchestrator withFailingStore = orchestrator(failingStore, properties);

        assertThatThrownBy(() -> withFailingStore.handle(SESSION, "Hi"))
                .isInstanceOf(StorageFailureException.class)
                .satisfies(e -> {
                    StorageFailureException sfe = (StorageFailureException) e;
                    assertThat(sfe.getSessionId()).isEqualTo(SESSION);
                    assertThat(sfe.getPendingMessages()).extracting(Message::getContent)
                            .containsExactly("Hi", "Hi there!");
                });
    }

    // ─── Context ────────────────────────────────────────────────────────────

    @Test
    void handle_similarPastMessage_injectsContextAsLeadingSystemMessage() {
        similarityStore.insert(EmbeddingRecord.of("old-session", "I like short haircuts",
                new float[]{1f, 0f, 0f}, clock.instant()));
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer("Noted!"));

        orchestrator.handle(SESSION, "Book my usual haircut");

        List<Message> prompt = capturePrompts().get(0);
        assertThat(prompt.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(prompt.get(0).getContent())
                .startsWith("Relevant context from past conversations:")
                .contains("I like short haircuts");
        assertThat(prompt.get(1).getContent()).isEqualTo("Book my usual haircut");

        // The context message is prompt-only, never stored
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages())
                .extracting(Message::getRole)
                .doesNotContain(Message.Role.system);
    }

    @Test
    void handle_noSnippetAboveThreshold_omitsContextMessage() {
        similarityStore.insert(EmbeddingRecord.of("old-session", "What time do you close?",
                new float[]{0f, 1f, 0f}, clock.instant()));
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer("Sure."));

        orchestrator.handle(SESSION, "Book a haircut");

        List<Message> prompt = capturePrompts().get(0);
        assertThat(prompt).extracting(Message::getRole).containsExactly(Message.Role.user);
    }

    @Test
    void handle_embeddingUnavailable_continuesWithoutContextOrEmbeddingRecord() {
        when(embeddingService.embed(anyString())).thenThrow(new ProviderUnavailableException("embedding down"));
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer("Hello!"));

        TurnOutcome outcome = orchestrator.handle(SESSION, "Hi");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.COMPLETED);
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).hasSize(2);
        assertThat(similarityStore.queryNearest(new float[]{1f, 0f, 0f}, 10)).isEmpty();
    }

    @Test
    void handle_followUpTurn_sendsStoredHistoryBeforeNewMessage() {
        when(llmClient.chat(anyList(), anyList(), any(Instant.class)))
                .thenReturn(answer("Which city?"))
                .thenReturn(answer("Looking in Athens."));

        orchestrator.handle(SESSION, "Find me a salon");
        orchestrator.handle(SESSION, "Athens");

        List<Message> secondPrompt = capturePrompts().get(1).stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .toList();
        assertThat(secondPrompt).extracting(Message::getContent)
                .containsExactly("Find me a salon", "Which city?", "Athens");
        assertThat(sessionStore.loadOrCreate(SESSION).getMessages()).hasSize(4);
    }

    @Test
    void handle_ragDisabled_runsWithoutRetrieval() {
        Orchestrator withoutRag = new Orchestrator(llmClient, toolRegistryClient, sessionStore, null,
                properties, new ObjectMapper(), clock);
        when(llmClient.chat(anyList(), anyList(), any(Instant.class))).thenReturn(answer("Hi!"));

        TurnOutcome outcome = withoutRag.handle(SESSION, "Hello");

        assertThat(outcome.getStatus()).isEqualTo(TurnOutcome.Status.COMPLETED);
        verifyNoInteractions(embeddingService);
    }

    @Test
    void toolResultContent_unavailable_isStructuredError() {
        String content = orchestrator.toolResultContent(ToolResult.unavailable("connection refused"));

        assertThat(content).isEqualTo("{\"error\":{\"kind\":\"ToolUnavailable\",\"message\":\"connection refused\"}}");
    }

    // ─── Helpers ────────────────────────────────────────────────────────────

    private Orchestrator orchestrator(SessionStore store, AgentProperties props) {
        RagRetriever retriever = new RagRetriever(embeddingService, similarityStore, 5, 0.7, clock);
        return new Orchestrator(llmClient, toolRegistryClient, store, retriever, props, new ObjectMapper(), clock);
    }

    @SuppressWarnings("unchecked")
    private List<List<Message>> capturePrompts() {
        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(llmClient, atLeastOnce()).chat(captor.capture(), anyList(), any(Instant.class));
        return captor.getAllValues();
    }

    private static ToolCall call(String id, String name, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(name).arguments(args).build();
    }

    private static LlmResponse toolRequest(ToolCall... calls) {
        return LlmResponse.builder().content("").toolCalls(List.of(calls)).build();
    }

    private static LlmResponse answer(String content) {
        return LlmResponse.builder().content(content).build();
    }

    static class MutableClock extends Clock {

        private Instant now = Instant.parse("2026-03-01T10:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
