package com.beautibuk.agent.session;

import com.beautibuk.agent.model.Message;

import java.util.List;

/**
 * Durable per-session message history.
 * Implementations wrap storage errors in {@link com.beautibuk.agent.exception.StorageFailureException}.
 */
public interface SessionStore {

    /**
     * Returns the session for {@code sessionId}, creating an empty one if none exists.
     * Idempotent: repeated calls for an unseen id yield the same empty history.
     */
    Session loadOrCreate(String sessionId);

    /**
     * Appends all messages of one turn, or none of them.
     *
     * @throws com.beautibuk.agent.exception.ProtocolViolationException if the batch contains an orphan
     *         tool result or leaves a tool call unanswered
     */
    void append(String sessionId, List<Message> messages);
}
