package com.beautibuk.agent.rag;

/**
 * A similarity query hit. {@code score} is cosine similarity in [-1, 1].
 */
public record ScoredRecord(EmbeddingRecord record, double score) {
}
