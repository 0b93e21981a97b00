package com.beautibuk.agent.session;

import com.beautibuk.agent.model.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable, ordered message history for one conversation.
 *
 * Collection: conversations. One document per session, messages embedded in order,
 * so appending a whole turn is a single-document (atomic) update.
 * Never deleted by the agent; expiry is an external policy.
 */
@Document(collection = "conversations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    @Id
    private String sessionId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Instant createdAt;

    @Indexed
    private Instant updatedAt;

    public static Session empty(String sessionId, Instant now) {
        return Session.builder()
                .sessionId(sessionId)
                .messages(new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** Detached copy; callers may mutate the returned message list freely. */
    public Session copy() {
        return Session.builder()
                .sessionId(sessionId)
                .messages(new ArrayList<>(messages != null ? messages : List.of()))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
