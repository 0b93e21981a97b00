package com.beautibuk.agent.llm;

import com.beautibuk.agent.exception.AgentException;
import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.beautibuk.agent.model.LlmResponse;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.model.ToolCall;
import com.beautibuk.agent.tool.ToolDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Google Gemini client (generateContent API).
 *
 * Role mapping: system → systemInstruction, assistant → model,
 * tool → function (functionResponse part). Gemini does not issue call ids,
 * so one is synthesized per functionCall part.
 */
@Slf4j
public class GeminiLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public GeminiLlmClient(LlmProviderProperties props,
                           ObjectMapper objectMapper,
                           RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("x-goog-api-key", props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages and {} tools to gemini [model={}]",
                messages.size(), tools.size(), props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/models/{model}:generateContent", props.getModel())
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("gemini 4xx [{}]: {}", res.getStatusCode(), body);
                        if (res.getStatusCode().value() == 429) {
                            throw new ProviderUnavailableException("gemini rate limit exceeded. Will retry.");
                        }
                        throw new AgentException("gemini client error [" + res.getStatusCode() + "]: " + body);
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("gemini 5xx [{}]: {}", res.getStatusCode(), body);
                        throw new ProviderUnavailableException(
                                "gemini server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (RestClientException e) {
            throw new ProviderUnavailableException("gemini request failed: " + e.getMessage(), e);
        } catch (ClassCastException | IllegalArgumentException e) {
            // Unexpected shapes, e.g. functionCall.args that is not an object
            throw new ProviderUnavailableException("gemini returned a malformed response", e);
        }
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> body = new LinkedHashMap<>();

        String systemText = messages.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(Message::getContent)
                .collect(Collectors.joining("\n\n"));
        if (!systemText.isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemText))));
        }

        List<Map<String, Object>> contents = messages.stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .map(this::formatContent)
                .toList();
        body.put("contents", contents);

        if (!tools.isEmpty()) {
            body.put("tools", List.of(Map.of("functionDeclarations",
                    tools.stream().map(ToolDefinition::toGeminiDeclaration).toList())));
        }

        body.put("generationConfig", Map.of(
                "temperature", props.getTemperature(),
                "maxOutputTokens", props.getMaxTokens()));
        return body;
    }

    private Map<String, Object> formatContent(Message msg) {
        List<Map<String, Object>> parts = new ArrayList<>();
        String role;

        switch (msg.getRole()) {
            case assistant -> {
                role = "model";
                if (msg.getContent() != null && !msg.getContent().isEmpty()) {
                    parts.add(Map.of("text", msg.getContent()));
                }
                if (msg.requestsTools()) {
                    msg.getToolCalls().forEach(tc -> parts.add(Map.of("functionCall", Map.of(
                            "name", tc.getToolName(),
                            "args", tc.getArguments() != null ? tc.getArguments() : Map.of()))));
                }
            }
            case tool -> {
                role = "function";
                parts.add(Map.of("functionResponse", Map.of(
                        "name", msg.getName() != null ? msg.getName() : "",
                        "response", Map.of("result", msg.getContent() != null ? msg.getContent() : ""))));
            }
            default -> {
                role = "user";
                parts.add(Map.of("text", msg.getContent() != null ? msg.getContent() : ""));
            }
        }

        if (parts.isEmpty()) {
            parts.add(Map.of("text", ""));
        }
        return Map.of("role", role, "parts", parts);
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new ProviderUnavailableException("gemini returned an empty body");
        }
        List<Map<String, Object>> candidates = (List<Map<String, Object>>) response.get("candidates");
        if (candidates == null || candidates.isEmpty()) {
            throw new ProviderUnavailableException("gemini returned no candidates in response");
        }

        Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
        List<Map<String, Object>> parts = content != null
                ? (List<Map<String, Object>>) content.get("parts")
                : null;
        if (parts == null) {
            throw new ProviderUnavailableException("gemini returned a candidate without content parts");
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map<String, Object> part : parts) {
            Map<String, Object> functionCall = (Map<String, Object>) part.get("functionCall");
            if (functionCall != null) {
                Object rawArgs = functionCall.get("args");
                Map<String, Object> args = rawArgs != null
                        ? objectMapper.convertValue(rawArgs, new TypeReference<Map<String, Object>>() {})
                        : Map.of();
                toolCalls.add(ToolCall.builder()
                        .id("gemini-" + UUID.randomUUID().toString().substring(0, 8))
                        .toolName((String) functionCall.get("name"))
                        .arguments(args)
                        .build());
            } else if (part.get("text") != null) {
                text.append(part.get("text"));
            }
        }

        int promptTokens = 0;
        int completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usageMetadata");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("promptTokenCount", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("candidatesTokenCount", 0)).intValue();
        }

        return LlmResponse.builder()
                .content(text.toString())
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
