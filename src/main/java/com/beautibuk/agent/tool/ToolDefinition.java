package com.beautibuk.agent.tool;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a remote tool's schema, as listed by the tool server.
 * Read-only to the orchestrator; handed to the LLM so it knows how to invoke the tool.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    /**
     * Converts to OpenAI's expected tool format.
     * OpenAI expects: { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description != null ? description : "",
                        "parameters", schemaOrEmpty()
                )
        );
    }

    /** Gemini's functionDeclarations entry: { "name", "description", "parameters" } */
    public Map<String, Object> toGeminiDeclaration() {
        Map<String, Object> declaration = new LinkedHashMap<>();
        declaration.put("name", name);
        declaration.put("description", description != null ? description : "");
        declaration.put("parameters", schemaOrEmpty());
        return declaration;
    }

    private Map<String, Object> schemaOrEmpty() {
        return inputSchema != null ? inputSchema : Map.of("type", "object", "properties", Map.of());
    }
}
