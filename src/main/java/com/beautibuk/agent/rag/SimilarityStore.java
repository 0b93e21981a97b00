package com.beautibuk.agent.rag;

import java.util.List;

/**
 * Durable storage of {@link EmbeddingRecord}s with nearest-neighbour queries over their vectors.
 *
 * Every store is bound to one dimensionality at construction. Implementations wrap storage
 * errors in {@link com.beautibuk.agent.exception.StorageFailureException}.
 */
public interface SimilarityStore {

    /**
     * @throws IllegalArgumentException if the record's vector length differs from {@link #dimensions()}
     */
    void insert(EmbeddingRecord record);

    /**
     * Up to {@code k} records ranked by descending cosine similarity to {@code vector}.
     *
     * @throws IllegalArgumentException if the query vector length differs from {@link #dimensions()}
     */
    List<ScoredRecord> queryNearest(float[] vector, int k);

    int dimensions();
}
