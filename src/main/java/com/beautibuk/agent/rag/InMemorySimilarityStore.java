package com.beautibuk.agent.rag;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Exact cosine ranking over records held in process. For local runs and tests.
 */
@Slf4j
public class InMemorySimilarityStore implements SimilarityStore {

    private final int dimensions;
    private final List<EmbeddingRecord> records = new CopyOnWriteArrayList<>();

    public InMemorySimilarityStore(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public void insert(EmbeddingRecord record) {
        VectorMath.requireDimensions(record.vectorArray(), dimensions);
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        records.add(record);
        log.debug("Stored embedding id={} owner={}", record.getId(), record.getOwnerId());
    }

    @Override
    public List<ScoredRecord> queryNearest(float[] vector, int k) {
        VectorMath.requireDimensions(vector, dimensions);
        return records.stream()
                .map(r -> new ScoredRecord(r, VectorMath.cosineSimilarity(vector, r.vectorArray())))
                .sorted(Comparator.comparingDouble(ScoredRecord::score).reversed())
                .limit(Math.max(k, 0))
                .toList();
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    int size() {
        return records.size();
    }
}
