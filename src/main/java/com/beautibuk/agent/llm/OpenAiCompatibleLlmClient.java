package com.beautibuk.agent.llm;

import com.beautibuk.agent.exception.AgentException;
import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.beautibuk.agent.model.LlmResponse;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.model.ToolCall;
import com.beautibuk.agent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible LLM client. Works with Groq and OpenAI.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                              |
 * |--------------------------|-----------------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried)                        |
 * | 400 model_decommissioned | AgentException with loud guidance message           |
 * | 400 tool_use_failed      | Recover from failed_generation XML, continue        |
 * | 400 other                | AgentException (not retried)                        |
 * | 429 / 5xx                | ProviderUnavailableException (retried)              |
 * | network error / timeout  | ProviderUnavailableException (retried)              |
 * | malformed payload        | ProviderUnavailableException (retried)              |
 */
@Slf4j
public class OpenAiCompatibleLlmClient implements LlmClient {

    // Matches BOTH broken XML formats Groq emits:
    // Format 1 (with parens):    <function=search_businesses({"arg": "val"})</function>
    // Format 2 (without parens): <function=search_businesses{"arg": "val"}></function>
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private static final String FORMATTING_APOLOGY =
            "I encountered a tool formatting issue. Please rephrase your request.";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public OpenAiCompatibleLlmClient(LlmProviderProperties props,
                                     ObjectMapper objectMapper,
                                     String providerName,
                                     RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                messages.size(), tools.size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new ProviderUnavailableException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (GroqToolUseFailedException e) {
            return recoverFromGroqToolUseFailure(e.getErrorBody());
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(providerName + " request failed: " + e.getMessage(), e);
        } catch (ClassCastException e) {
            throw new ProviderUnavailableException(providerName + " returned a malformed response", e);
        }
    }

    /**
     * Central 4xx error handler: maps error codes to exception types
     * so retry treats each case correctly.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update llm.{}.model in application.yml or set LLM_MODEL", providerName);
            log.error("================================================================");
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned.");
        }

        // Groq emitted XML tool syntax instead of JSON; handled by recoverFromGroqToolUseFailure
        if (body.contains("tool_use_failed")) {
            throw new GroqToolUseFailedException(body);
        }

        if (statusCode == 401) {
            throw new AgentException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new ProviderUnavailableException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    /**
     * Groq's tool_use_failed error contains the broken generation in "failed_generation".
     * Every XML-style call in it is parsed, in order, into a ToolCall.
     */
    @SuppressWarnings("unchecked")
    private LlmResponse recoverFromGroqToolUseFailure(String errorBody) {
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error    = (Map<String, Object>) errorMap.get("error");
            String failedGeneration      = error != null ? (String) error.get("failed_generation") : null;

            if (failedGeneration == null || failedGeneration.isBlank()) {
                log.warn("Groq tool_use_failed with no failed_generation, cannot recover");
                return plainTextResponse(FORMATTING_APOLOGY);
            }

            log.debug("Recovering from Groq tool_use_failed. Generation: {}", failedGeneration);

            List<ToolCall> calls = new ArrayList<>();
            Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
            while (matcher.find()) {
                Map<String, Object> args = objectMapper.readValue(matcher.group(2), new TypeReference<>() {});
                calls.add(ToolCall.builder()
                        .id("groq-recovered-" + UUID.randomUUID().toString().substring(0, 8))
                        .toolName(matcher.group(1))
                        .arguments(args)
                        .build());
            }

            if (calls.isEmpty()) {
                log.warn("Could not parse XML tool call from failed_generation: {}", failedGeneration);
                return plainTextResponse(FORMATTING_APOLOGY);
            }

            log.info("Recovered {} Groq tool call(s): {}", calls.size(),
                    calls.stream().map(ToolCall::getToolName).toList());
            return LlmResponse.builder().toolCalls(calls).build();

        } catch (JsonProcessingException | ClassCastException e) {
            log.error("Failed to recover from Groq tool_use_failed: {}", e.getMessage());
            return plainTextResponse(FORMATTING_APOLOGY);
        }
    }

    private LlmResponse plainTextResponse(String message) {
        return LlmResponse.builder().content(message).build();
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.requestsTools()) {
            // The tool_calls array must be echoed back or the model cannot correlate the results
            m.put("content", msg.getContent() == null || msg.getContent().isEmpty() ? null : msg.getContent());
            m.put("tool_calls", msg.getToolCalls().stream()
                    .map(this::formatToolCall)
                    .toList());
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");

        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    tc.getArguments() != null ? tc.getArguments() : Map.of()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new ProviderUnavailableException(providerName + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ProviderUnavailableException(providerName + " returned no choices in response");
        }

        int promptTokens = 0;
        int completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        if (message == null) {
            throw new ProviderUnavailableException(providerName + " returned a choice without a message");
        }

        log.debug("{} finish_reason: {}", providerName, choices.get(0).get("finish_reason"));

        List<Map<String, Object>> rawCalls = (List<Map<String, Object>>) message.get("tool_calls");
        List<ToolCall> toolCalls = new ArrayList<>();
        if (rawCalls != null) {
            for (Map<String, Object> raw : rawCalls) {
                toolCalls.add(parseToolCall(raw));
            }
        }

        return LlmResponse.builder()
                .content((String) message.get("content"))
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolCall parseToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        if (function == null || function.get("name") == null) {
            throw new ProviderUnavailableException(providerName + " returned a tool call without a function name");
        }

        Map<String, Object> args;
        Object rawArgs = function.get("arguments");
        try {
            if (rawArgs == null || (rawArgs instanceof String s && s.isBlank())) {
                args = Map.of();
            } else if (rawArgs instanceof String s) {
                args = objectMapper.readValue(s, new TypeReference<>() {});
            } else {
                args = objectMapper.convertValue(rawArgs, new TypeReference<>() {});
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProviderUnavailableException("Failed to parse tool arguments from " + providerName, e);
        }

        String id = (String) raw.get("id");
        return ToolCall.builder()
                .id(id != null ? id : "call_" + UUID.randomUUID().toString().substring(0, 8))
                .toolName((String) function.get("name"))
                .arguments(args)
                .build();
    }

    private static class GroqToolUseFailedException extends RuntimeException {
        private final String errorBody;

        GroqToolUseFailedException(String errorBody) {
            super("Groq tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
