package com.beautibuk.agent.rag;

import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.beautibuk.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds prior user messages semantically close to the current one.
 *
 * Matches below the similarity threshold are discarded; survivors are ordered best first so the
 * most relevant snippet is the last to go if a provider truncates the prompt.
 * An embedding-provider failure degrades to "no context": retrieval never fails a turn
 * on its own, only the similarity store's {@link com.beautibuk.agent.exception.StorageFailureException} does.
 */
@Slf4j
public class RagRetriever {

    static final String CONTEXT_HEADER = "Relevant context from past conversations:\n";

    private final EmbeddingService embeddingService;
    private final SimilarityStore similarityStore;
    private final int topK;
    private final double similarityThreshold;
    private final Clock clock;

    public RagRetriever(EmbeddingService embeddingService,
                        SimilarityStore similarityStore,
                        int topK,
                        double similarityThreshold,
                        Clock clock) {
        this.embeddingService = embeddingService;
        this.similarityStore = similarityStore;
        this.topK = topK;
        this.similarityThreshold = similarityThreshold;
        this.clock = clock;
    }

    public RetrievalResult retrieve(String text) {
        return retrieve(text, similarityThreshold);
    }

    public RetrievalResult retrieve(String text, double threshold) {
        float[] queryVector;
        try {
            queryVector = embeddingService.embed(text);
        } catch (ProviderUnavailableException e) {
            log.warn("Embedding unavailable, continuing without context: {}", e.getMessage());
            return RetrievalResult.unavailable();
        }

        List<ScoredRecord> snippets = similarityStore.queryNearest(queryVector, topK).stream()
                .filter(sr -> sr.score() >= threshold)
                .toList();

        log.debug("Retrieved {} snippet(s) above threshold {}", snippets.size(), threshold);
        return new RetrievalResult(queryVector, snippets);
    }

    /**
     * Stores the embedding of a user message so later turns can retrieve it.
     *
     * @throws com.beautibuk.agent.exception.StorageFailureException if the similarity store rejects the write
     */
    public void remember(String ownerId, String text, float[] vector) {
        similarityStore.insert(EmbeddingRecord.of(ownerId, text, vector, clock.instant()));
    }

    /**
     * The system message carrying the snippets, or empty when there are none.
     */
    public static Optional<Message> buildContextMessage(List<ScoredRecord> snippets) {
        if (snippets.isEmpty()) {
            return Optional.empty();
        }
        String body = snippets.stream()
                .map(sr -> "- " + sr.record().getText())
                .collect(Collectors.joining("\n"));
        return Optional.of(Message.system(CONTEXT_HEADER + body));
    }
}
