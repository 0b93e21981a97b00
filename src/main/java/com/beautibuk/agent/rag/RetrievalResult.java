package com.beautibuk.agent.rag;

import java.util.List;

/**
 * Outcome of one retrieval.
 *
 * @param queryVector embedding of the query text, or {@code null} when the embedding provider failed
 * @param snippets    qualifying matches, best first; empty is a normal outcome
 */
public record RetrievalResult(float[] queryVector, List<ScoredRecord> snippets) {

    public static RetrievalResult unavailable() {
        return new RetrievalResult(null, List.of());
    }

    public boolean hasQueryVector() {
        return queryVector != null;
    }

    public boolean isEmpty() {
        return snippets.isEmpty();
    }
}
