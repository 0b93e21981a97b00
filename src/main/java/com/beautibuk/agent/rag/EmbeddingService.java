package com.beautibuk.agent.rag;

import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Generates text embeddings through the configured provider.
 *
 * Caching strategy:
 * - Embeddings for the same (model, text) are deterministic, so cache aggressively
 * - Redis cache key: embed:{model}:{sha256(text)}
 * - TTL: 7 days
 * - A Redis failure is a cache miss, never an embedding failure
 *
 * Every vector is checked against the configured dimensionality: a provider
 * answering with another length is misconfigured, and its vectors must never reach the store.
 */
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "embed:";
    private static final Duration CACHE_TTL = Duration.ofDays(7);

    private final EmbeddingClient embeddingClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Retry retry;
    private final int dimensions;

    public EmbeddingService(EmbeddingClient embeddingClient,
                            StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper,
                            Retry retry,
                            int dimensions) {
        this.embeddingClient = embeddingClient;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.retry = retry;
        this.dimensions = dimensions;
    }

    /**
     * Get the embedding for a text string: from cache if available, otherwise from the provider.
     *
     * @throws ProviderUnavailableException if the provider fails after retries or returns the wrong length
     */
    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + embeddingClient.modelName() + ":" + sha256(text);

        float[] cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Embedding cache hit for text length={}", text.length());
            return cached;
        }

        float[] embedding = retry.executeSupplier(() -> embeddingClient.embed(text));

        if (embedding.length != dimensions) {
            throw new ProviderUnavailableException("Embedding provider returned " + embedding.length
                    + " dimensions, expected " + dimensions);
        }

        writeCache(cacheKey, embedding);
        log.debug("Fetched embedding: {} dimensions", embedding.length);
        return embedding;
    }

    public int dimensions() {
        return dimensions;
    }

    private float[] readCache(String cacheKey) {
        if (redisTemplate == null) {
            return null;
        }
        try {
            String json = redisTemplate.opsForValue().get(cacheKey);
            if (json == null) {
                return null;
            }
            float[] vector = objectMapper.readValue(json, float[].class);
            return vector.length == dimensions ? vector : null;
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Embedding cache read failed, re-fetching: {}", e.getMessage());
            return null;
        }
    }

    private void writeCache(String cacheKey, float[] embedding) {
        if (redisTemplate == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(cacheKey, objectMapper.writeValueAsString(embedding), CACHE_TTL);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
