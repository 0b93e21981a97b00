package com.beautibuk.agent.session;

import com.beautibuk.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store for local runs and tests (agent.session.store=memory).
 * Each append is atomic per session through {@link ConcurrentHashMap#compute}.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Session loadOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.debug("Created session {}", id);
            return Session.empty(id, clock.instant());
        }).copy();
    }

    @Override
    public void append(String sessionId, List<Message> messages) {
        ToolCallLedger.validateTurn(messages);

        sessions.compute(sessionId, (id, existing) -> {
            Session base = existing != null ? existing : Session.empty(id, clock.instant());
            List<Message> updated = new ArrayList<>(base.getMessages());
            updated.addAll(messages);
            return Session.builder()
                    .sessionId(id)
                    .messages(updated)
                    .createdAt(base.getCreatedAt())
                    .updatedAt(clock.instant())
                    .build();
        });
        log.debug("Appended {} messages to session {}", messages.size(), sessionId);
    }
}
