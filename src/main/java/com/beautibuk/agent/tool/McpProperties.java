package com.beautibuk.agent.tool;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the MCP tool server. Bound from the "mcp" prefix.
 */
@Data
@ConfigurationProperties(prefix = "mcp")
public class McpProperties {

    private String serverUrl = "http://localhost:8002";
    private String endpointPath = "/mcp";
    private String protocolVersion = "2024-11-05";
    private String clientName = "beautibuk-agent";
    private String clientVersion = "1.0.0";
}
