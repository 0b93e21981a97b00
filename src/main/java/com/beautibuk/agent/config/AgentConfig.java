package com.beautibuk.agent.config;

import com.beautibuk.agent.session.InMemorySessionStore;
import com.beautibuk.agent.session.MongoSessionStore;
import com.beautibuk.agent.session.SessionCache;
import com.beautibuk.agent.session.SessionStore;
import com.beautibuk.agent.tool.McpProperties;
import com.beautibuk.agent.tool.McpToolRegistryClient;
import com.beautibuk.agent.tool.ToolRegistryClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Session store and tool server wiring.
 */
@Configuration
@Slf4j
public class AgentConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * agent.session.store = mongo (default) | memory
     */
    @Bean
    public SessionStore sessionStore(AgentProperties props,
                                     ObjectProvider<MongoTemplate> mongoTemplate,
                                     ObjectProvider<StringRedisTemplate> redisTemplate,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        AgentProperties.Session session = props.getSession();

        if ("memory".equalsIgnoreCase(session.getStore())) {
            log.info("Session store: in-memory (history is lost on restart)");
            return new InMemorySessionStore(clock);
        }

        SessionCache cache = session.getCache().isEnabled()
                ? new SessionCache(redisTemplate.getObject(), objectMapper,
                        Duration.ofMinutes(session.getCache().getTtlMinutes()), true)
                : SessionCache.disabled();

        log.info("Session store: mongo [cache={}, ttl={}m]",
                session.getCache().isEnabled(), session.getCache().getTtlMinutes());
        return new MongoSessionStore(mongoTemplate.getObject(), cache, clock);
    }

    @Bean
    public ToolRegistryClient toolRegistryClient(McpProperties mcpProperties,
                                                 ObjectMapper objectMapper,
                                                 @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {
        log.info("Tool server: {}{}", mcpProperties.getServerUrl(), mcpProperties.getEndpointPath());
        return new McpToolRegistryClient(mcpProperties, objectMapper, builder.clone());
    }
}
