package com.beautibuk.agent.exception;

import com.beautibuk.agent.model.Message;
import lombok.Getter;

import java.util.List;

/**
 * Session store or similarity store read/write failure. Fatal for the current turn.
 * Carries the messages the turn produced so the caller can retry the write.
 */
@Getter
public class StorageFailureException extends AgentException {

    private final String sessionId;
    private final List<Message> pendingMessages;

    public StorageFailureException(String message, Throwable cause) {
        this(message, cause, null, List.of());
    }

    public StorageFailureException(String message, Throwable cause,
                                   String sessionId, List<Message> pendingMessages) {
        super(message, cause);
        this.sessionId = sessionId;
        this.pendingMessages = pendingMessages != null ? List.copyOf(pendingMessages) : List.of();
    }

    public StorageFailureException withTurn(String sessionId, List<Message> pendingMessages) {
        return new StorageFailureException(getMessage(), getCause(), sessionId, pendingMessages);
    }
}
