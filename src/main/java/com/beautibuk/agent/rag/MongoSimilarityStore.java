package com.beautibuk.agent.rag;

import com.beautibuk.agent.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Comparator;
import java.util.List;

/**
 * Similarity store backed by the conversation_embeddings collection.
 *
 * Ranking is exact: candidates are loaded and scored with cosine similarity in Java, which
 * works against any MongoDB deployment. Records whose stored vector has another length
 * (written under a different embedding model) are filtered out by MongoDB with $size.
 *
 * Each query scores at most {@code maxCandidates} records, newest first, and loads only
 * text, vector and ownerId. Memory per query is roughly maxCandidates x dimensions x 8 bytes
 * (about 60 MB for 10,000 records of 768 dimensions); older records fall out of reach
 * once the collection outgrows the ceiling.
 *
 * With Atlas Vector Search the query could become a $vectorSearch aggregation stage over the
 * 'vector' field without changing this contract.
 */
@Slf4j
public class MongoSimilarityStore implements SimilarityStore {

    private final MongoTemplate mongoTemplate;
    private final int dimensions;
    private final int maxCandidates;

    public MongoSimilarityStore(MongoTemplate mongoTemplate, int dimensions, int maxCandidates) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be positive");
        }
        this.mongoTemplate = mongoTemplate;
        this.dimensions = dimensions;
        this.maxCandidates = maxCandidates;
    }

    @Override
    public void insert(EmbeddingRecord record) {
        VectorMath.requireDimensions(record.vectorArray(), dimensions);
        try {
            mongoTemplate.insert(record);
            log.debug("Stored embedding id={} owner={}", record.getId(), record.getOwnerId());
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to store embedding for owner " + record.getOwnerId(), e);
        }
    }

    @Override
    public List<ScoredRecord> queryNearest(float[] vector, int k) {
        VectorMath.requireDimensions(vector, dimensions);

        Query query = new Query(Criteria.where("vector").size(dimensions))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(maxCandidates);
        query.fields().include("text", "vector", "ownerId");

        List<EmbeddingRecord> candidates;
        try {
            candidates = mongoTemplate.find(query, EmbeddingRecord.class);
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to query embeddings", e);
        }

        List<ScoredRecord> hits = candidates.stream()
                .filter(r -> r.getVector() != null && r.getVector().size() == dimensions)
                .map(r -> new ScoredRecord(r, VectorMath.cosineSimilarity(vector, r.vectorArray())))
                .sorted(Comparator.comparingDouble(ScoredRecord::score).reversed())
                .limit(Math.max(k, 0))
                .toList();
        if (candidates.size() == maxCandidates) {
            log.debug("Similarity query hit the candidate ceiling of {}", maxCandidates);
        }
        return hits;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
