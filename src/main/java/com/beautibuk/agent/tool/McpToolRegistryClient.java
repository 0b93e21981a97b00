package com.beautibuk.agent.tool;

import com.beautibuk.agent.exception.ProtocolViolationException;
import com.beautibuk.agent.exception.ToolExecutionFailedException;
import com.beautibuk.agent.exception.ToolUnavailableException;
import com.beautibuk.agent.exception.UnknownToolException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 client for the MCP tool server over HTTP.
 *
 * Every request is a POST of {"jsonrpc","id","method","params"} to the configured endpoint.
 * The client performs the initialize handshake once, lazily, before the first real request.
 *
 * Error mapping:
 *
 * | Condition                              | Result                               |
 * |----------------------------------------|--------------------------------------|
 * | connection refused, timeout, non-2xx   | ToolUnavailableException / UNAVAILABLE |
 * | JSON-RPC "error" object                | ToolExecutionFailed{code, message}   |
 * | tools/call result with isError = true  | ToolExecutionFailed{-32000, text}    |
 * | response id != request id              | ProtocolViolationException           |
 * | tool name never listed                 | UnknownToolException (not sent)      |
 */
@Slf4j
public class McpToolRegistryClient implements ToolRegistryClient {

    private static final String JSONRPC_VERSION = "2.0";

    /** JSON-RPC implementation-defined server error, used when a tool reports failure in its result */
    static final int TOOL_REPORTED_ERROR = -32000;

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {};

    private final McpProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    // Scoped to this instance, never reused: correlation of concurrent in-flight calls depends on it
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final Object initLock = new Object();

    private volatile Set<String> knownTools = Set.of();

    public McpToolRegistryClient(McpProperties props,
                                 ObjectMapper objectMapper,
                                 RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getServerUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public List<ToolDefinition> listTools() {
        JsonNode result;
        try {
            ensureInitialized();
            result = sendRequest("tools/list", Map.of());
        } catch (ToolExecutionFailedException | ProtocolViolationException e) {
            throw new ToolUnavailableException("Tool listing failed: " + e.getMessage(), e);
        }

        List<ToolDefinition> tools = parseToolDefinitions(result);
        Set<String> names = new LinkedHashSet<>();
        tools.forEach(t -> names.add(t.getName()));
        knownTools = Set.copyOf(names);

        log.debug("Tool server listed {} tools: {}", tools.size(), names);
        return tools;
    }

    @Override
    public ToolResult callTool(String name, Map<String, Object> arguments) {
        if (!knownTools.contains(name)) {
            log.warn("Rejecting call to unknown tool '{}'. Known tools: {}", name, knownTools);
            throw new UnknownToolException(name);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());

        try {
            ensureInitialized();
            JsonNode result = sendRequest("tools/call", params);
            return parseToolCallResult(name, result);
        } catch (ToolUnavailableException e) {
            log.warn("Tool [{}] unavailable: {}", name, e.getMessage());
            return ToolResult.unavailable(e.getMessage());
        } catch (ToolExecutionFailedException e) {
            log.info("Tool [{}] failed [{}]: {}", name, e.getCode(), e.getRemoteMessage());
            return ToolResult.executionFailed(e.getCode(), e.getRemoteMessage());
        }
    }

    /** Highest request id handed out so far. */
    long lastRequestId() {
        return nextId.get() - 1;
    }

    private void ensureInitialized() {
        if (initialized.get()) {
            return;
        }
        synchronized (initLock) {
            if (initialized.get()) {
                return;
            }
            try {
                JsonNode result = sendRequest("initialize", Map.of(
                        "protocolVersion", props.getProtocolVersion(),
                        "capabilities", Map.of(),
                        "clientInfo", Map.of(
                                "name", props.getClientName(),
                                "version", props.getClientVersion())));
                log.info("MCP session initialized with {}: {}", props.getServerUrl(),
                        result != null ? result.path("serverInfo") : "{}");
            } catch (ToolExecutionFailedException | ProtocolViolationException e) {
                throw new ToolUnavailableException("MCP initialization failed: " + e.getMessage(), e);
            }
            sendNotification("notifications/initialized");
            initialized.set(true);
        }
    }

    JsonNode sendRequest(String method, Map<String, Object> params) {
        long id = nextId.getAndIncrement();

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        log.debug("MCP → [{}] {}", id, method);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(props.getEndpointPath())
                    .body(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        throw new ToolUnavailableException(
                                "Tool server HTTP error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            // ResourceAccessException (refused / timeout) and unreadable bodies
            throw new ToolUnavailableException("Tool server unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.isNull()) {
            throw new ToolUnavailableException("Tool server returned an empty response to " + method);
        }

        long responseId = response.path("id").asLong(-1);
        if (responseId != id) {
            throw new ProtocolViolationException(
                    "MCP response id " + responseId + " does not match request id " + id);
        }

        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new ToolExecutionFailedException(
                    error.path("code").asInt(TOOL_REPORTED_ERROR),
                    error.path("message").asText("Unknown MCP error"));
        }

        return response.get("result");
    }

    private void sendNotification(String method) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);

        try {
            restClient.post()
                    .uri(props.getEndpointPath())
                    .body(notification)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            log.warn("Failed to send MCP notification {}: {}", method, e.getMessage());
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            throw new ToolUnavailableException("No tools in MCP response");
        }

        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            throw new ToolUnavailableException("No tools in MCP response");
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.path("name").asText(null);
            if (name == null || name.isBlank()) {
                log.warn("Skipping MCP tool without a name: {}", toolNode);
                continue;
            }

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("Failed to parse inputSchema for tool '{}': {}", name, e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(toolNode.path("description").asText(""))
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.executionFailed(TOOL_REPORTED_ERROR, "No content in MCP tool response: " + toolName);
        }

        StringBuilder output = new StringBuilder();
        boolean hasTextPart = false;
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.path("type").asText("text");
                if ("text".equals(type) && item.has("text")) {
                    hasTextPart = true;
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (result.path("isError").asBoolean(false)) {
            return ToolResult.executionFailed(TOOL_REPORTED_ERROR,
                    output.isEmpty() ? "Tool reported an error" : output.toString());
        }
        // An empty text part is a valid empty answer; only a missing one is a failure
        if (!hasTextPart) {
            return ToolResult.executionFailed(TOOL_REPORTED_ERROR, "No content in MCP tool response: " + toolName);
        }
        return ToolResult.success(output.toString());
    }
}
