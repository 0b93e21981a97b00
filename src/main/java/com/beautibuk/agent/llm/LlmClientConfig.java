package com.beautibuk.agent.llm;

import com.beautibuk.agent.resilience.ResilientLlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Factory that creates the active LLM client based on the LLM_PROVIDER env var,
 * wrapped by ResilientLlmClient (retry + circuit breaker).
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    static final String RESILIENCE_INSTANCE = "llmClient";

    @Value("${llm.provider:groq}")
    private String provider;

    // Groq
    @Value("${llm.groq.api-key:}") private String groqKey;
    @Value("${llm.groq.base-url}") private String groqBaseUrl;
    @Value("${llm.groq.model}")    private String groqModel;
    @Value("${llm.groq.max-tokens:2000}") private int groqMaxTokens;
    @Value("${llm.groq.temperature:0.7}") private double groqTemp;

    // OpenAI
    @Value("${llm.openai.api-key:}") private String openAiKey;
    @Value("${llm.openai.base-url}") private String openAiBaseUrl;
    @Value("${llm.openai.model}")    private String openAiModel;
    @Value("${llm.openai.max-tokens:2000}") private int openAiMaxTokens;
    @Value("${llm.openai.temperature:0.7}") private double openAiTemp;

    // Gemini
    @Value("${llm.gemini.api-key:}") private String geminiKey;
    @Value("${llm.gemini.base-url}") private String geminiBaseUrl;
    @Value("${llm.gemini.model}")    private String geminiModel;
    @Value("${llm.gemini.max-tokens:2000}") private int geminiMaxTokens;
    @Value("${llm.gemini.temperature:0.7}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    /**
     * The vendor adapter selected by LLM_PROVIDER, without resilience.
     */
    @Bean("vendorLlmClient")
    public LlmClient vendorLlmClient(
            ObjectMapper objectMapper,
            @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {

        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new OpenAiCompatibleLlmClient(
                        props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp),
                        objectMapper, "openai", builder.clone());
            }
            case "gemini", "google" -> {
                logKey("GEMINI", geminiKey, "GOOGLE_AI_API_KEY");
                yield new GeminiLlmClient(
                        props(geminiKey, geminiBaseUrl, geminiModel, geminiMaxTokens, geminiTemp),
                        objectMapper, builder.clone());
            }
            default -> { // groq
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new OpenAiCompatibleLlmClient(
                        props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp),
                        objectMapper, "groq", builder.clone());
            }
        };
    }

    /**
     * What the orchestrator talks to.
     */
    @Bean
    @Primary
    public LlmClient llmClient(@Qualifier("vendorLlmClient") LlmClient vendorLlmClient,
                               RetryRegistry retryRegistry,
                               CircuitBreakerRegistry circuitBreakerRegistry,
                               Clock clock) {
        return new ResilientLlmClient(vendorLlmClient,
                retryRegistry.retry(RESILIENCE_INSTANCE),
                circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE),
                clock);
    }

    private LlmProviderProperties props(String key, String baseUrl, String model, int maxTokens, double temp) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temp);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiModel;
            case "gemini", "google" -> geminiModel;
            default -> groqModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
