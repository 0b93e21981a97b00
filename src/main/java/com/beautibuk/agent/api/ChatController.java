package com.beautibuk.agent.api;

import com.beautibuk.agent.core.Orchestrator;
import com.beautibuk.agent.core.TurnOutcome;
import com.beautibuk.agent.model.ChatRequest;
import com.beautibuk.agent.model.ChatResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Chat endpoint.
 *
 * POST /api/v1/chat   {message, session_id?} → {response, session_id}
 *   A missing or blank session_id starts a new session under a random UUID.
 *
 * GET /api/v1/health
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final Orchestrator orchestrator;

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        String sessionId = resolveSessionId(request.getSessionId());
        log.info("Chat request [sessionId={}, new={}]", sessionId, !sessionId.equals(request.getSessionId()));

        TurnOutcome outcome = orchestrator.handle(sessionId, request.getMessage());
        return ResponseEntity.ok(outcome.toChatResponse());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private String resolveSessionId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }
}
