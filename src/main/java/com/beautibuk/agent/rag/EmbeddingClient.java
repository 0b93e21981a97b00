package com.beautibuk.agent.rag;

/**
 * Capability interface over an embedding provider: text in, fixed-length vector out.
 */
public interface EmbeddingClient {

    /**
     * @throws com.beautibuk.agent.exception.ProviderUnavailableException on transport failure or an unreadable payload
     */
    float[] embed(String text);

    /** Model identifier; part of the embedding cache key */
    String modelName();
}
