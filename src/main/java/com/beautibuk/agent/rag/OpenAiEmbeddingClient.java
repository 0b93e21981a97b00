package com.beautibuk.agent.rag;

import com.beautibuk.agent.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Embeddings via an OpenAI-compatible /embeddings endpoint.
 * Requests the configured dimensionality explicitly so the store's fixed length holds.
 */
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private final RestClient restClient;
    private final String model;
    private final int dimensions;

    public OpenAiEmbeddingClient(String baseUrl, String apiKey, String model, int dimensions,
                                 RestClient.Builder restClientBuilder) {
        this.model = model;
        this.dimensions = dimensions;
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public float[] embed(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> request = Map.of(
                "model", model,
                "input", text,
                "dimensions", dimensions
        );

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .body(request)
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Embedding request failed: " + e.getMessage(), e);
        }

        try {
            List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
            List<Number> rawEmbedding = (List<Number>) data.get(0).get("embedding");
            return VectorMath.toFloatArray(rawEmbedding);
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Malformed embedding response", e);
        }
    }

    @Override
    public String modelName() {
        return model;
    }
}
