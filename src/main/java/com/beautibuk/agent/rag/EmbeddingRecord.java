package com.beautibuk.agent.rag;

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
 * One embedded user message. Written once per stored user message, never mutated.
 *
 * Collection: conversation_embeddings
 *
 * {@code ownerId} is a non-owning back-reference to the session the text came from;
 * deleting a session leaves its embeddings in place.
 */
@Document(collection = "conversation_embeddings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingRecord {

    @Id
    private String id;

    @Indexed
    private String ownerId;

    private String text;

    /** Stored as a native List<Double>; all records of one collection share its length */
    private List<Double> vector;

    @Indexed
    private Instant createdAt;

    public static EmbeddingRecord of(String ownerId, String text, float[] vector, Instant createdAt) {
        return EmbeddingRecord.builder()
                .ownerId(ownerId)
                .text(text)
                .vector(VectorMath.toDoubleList(vector))
                .createdAt(createdAt)
                .build();
    }

    public float[] vectorArray() {
        return VectorMath.toFloatArray(vector != null ? vector : new ArrayList<>());
    }
}
