package com.beautibuk.agent.rag;

import com.beautibuk.agent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Retrieval wiring. With agent.rag.enabled=false none of these beans exist and the
 * orchestrator runs without context injection or embedding records.
 */
@Configuration
@ConditionalOnProperty(prefix = "agent.rag", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RagConfig {

    static final String RESILIENCE_INSTANCE = "embeddingClient";

    @Value("${embedding.provider:gemini}")
    private String provider;

    // Gemini
    @Value("${embedding.gemini.api-key:}") private String geminiKey;
    @Value("${embedding.gemini.base-url:https://generativelanguage.googleapis.com/v1beta}") private String geminiBaseUrl;
    @Value("${embedding.gemini.model:text-embedding-004}") private String geminiModel;

    // OpenAI
    @Value("${embedding.openai.api-key:}") private String openAiKey;
    @Value("${embedding.openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${embedding.openai.model:text-embedding-3-small}") private String openAiModel;

    @Bean
    public EmbeddingClient embeddingClient(AgentProperties props,
                                           @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {
        if ("openai".equalsIgnoreCase(provider)) {
            log.info("Embedding provider: OPENAI [model={}, dimensions={}]", openAiModel, props.getRag().getDimensions());
            return new OpenAiEmbeddingClient(openAiBaseUrl, openAiKey, openAiModel,
                    props.getRag().getDimensions(), builder.clone());
        }
        log.info("Embedding provider: GEMINI [model={}, dimensions={}]", geminiModel, props.getRag().getDimensions());
        return new GeminiEmbeddingClient(geminiBaseUrl, geminiKey, geminiModel, builder.clone());
    }

    @Bean
    public EmbeddingService embeddingService(EmbeddingClient embeddingClient,
                                             StringRedisTemplate redisTemplate,
                                             ObjectMapper objectMapper,
                                             RetryRegistry retryRegistry,
                                             AgentProperties props) {
        return new EmbeddingService(embeddingClient, redisTemplate, objectMapper,
                retryRegistry.retry(RESILIENCE_INSTANCE), props.getRag().getDimensions());
    }

    /**
     * agent.rag.store = mongo (default) | memory
     */
    @Bean
    public SimilarityStore similarityStore(AgentProperties props, ObjectProvider<MongoTemplate> mongoTemplate) {
        int dimensions = props.getRag().getDimensions();
        if ("memory".equalsIgnoreCase(props.getRag().getStore())) {
            log.info("Similarity store: in-memory [dimensions={}]", dimensions);
            return new InMemorySimilarityStore(dimensions);
        }
        int maxCandidates = props.getRag().getMaxCandidates();
        log.info("Similarity store: mongo [dimensions={}, maxCandidates={}]", dimensions, maxCandidates);
        return new MongoSimilarityStore(mongoTemplate.getObject(), dimensions, maxCandidates);
    }

    @Bean
    public RagRetriever ragRetriever(EmbeddingService embeddingService,
                                     SimilarityStore similarityStore,
                                     AgentProperties props,
                                     Clock clock) {
        AgentProperties.Rag rag = props.getRag();
        return new RagRetriever(embeddingService, similarityStore, rag.getTopK(), rag.getSimilarityThreshold(), clock);
    }
}
