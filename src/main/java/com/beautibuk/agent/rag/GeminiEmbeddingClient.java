package com.beautibuk.agent.rag;

import com.beautibuk.agent.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Google embedContent API. text-embedding-004 yields 768 dimensions.
 */
@Slf4j
public class GeminiEmbeddingClient implements EmbeddingClient {

    private final RestClient restClient;
    private final String model;

    public GeminiEmbeddingClient(String baseUrl, String apiKey, String model,
                                 RestClient.Builder restClientBuilder) {
        this.model = model;
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public float[] embed(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> request = Map.of(
                "model", "models/" + model,
                "content", Map.of("parts", List.of(Map.of("text", text)))
        );

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/models/{model}:embedContent", model)
                    .body(request)
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Embedding request failed: " + e.getMessage(), e);
        }

        try {
            Map<String, Object> embedding = (Map<String, Object>) response.get("embedding");
            return VectorMath.toFloatArray((List<Number>) embedding.get("values"));
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Malformed embedding response", e);
        }
    }

    @Override
    public String modelName() {
        return model;
    }
}
