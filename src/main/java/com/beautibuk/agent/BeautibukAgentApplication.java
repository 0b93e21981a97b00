package com.beautibuk.agent;

import com.beautibuk.agent.config.AgentProperties;
import com.beautibuk.agent.tool.McpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AgentProperties.class, McpProperties.class})
public class BeautibukAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(BeautibukAgentApplication.class, args);
    }
}
