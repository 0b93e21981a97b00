package com.beautibuk.agent.tool;

import java.util.List;
import java.util.Map;

/**
 * Discovers and invokes the tools exposed by the remote tool server.
 * Stateless apart from transport plumbing.
 */
public interface ToolRegistryClient {

    /**
     * Current tool catalog, in the order the server lists it.
     * Idempotent and side-effect-free.
     *
     * @throws com.beautibuk.agent.exception.ToolUnavailableException if the catalog cannot be fetched
     */
    List<ToolDefinition> listTools();

    /**
     * Invoke a previously listed tool. Arguments are passed through untouched;
     * they are not checked against the tool's input schema.
     *
     * @throws com.beautibuk.agent.exception.UnknownToolException if {@code name} was never listed
     */
    ToolResult callTool(String name, Map<String, Object> arguments);
}
