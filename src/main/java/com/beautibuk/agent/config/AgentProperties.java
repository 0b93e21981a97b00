package com.beautibuk.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the agent core.
 * Bound from application.yml under the "agent" prefix.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private Loop loop = new Loop();
    private Rag rag = new Rag();
    private Session session = new Session();
    private Http http = new Http();

    @Data
    public static class Loop {
        /** Tool-calling rounds allowed per turn before the fallback reply is forced */
        private int maxToolRounds = 5;
        /** Wall-clock budget for one whole turn */
        private Duration turnTimeout = Duration.ofSeconds(60);
        /** History messages sent to the model; the stored session is never truncated */
        private int maxContextMessages = 40;
    }

    @Data
    public static class Rag {
        private boolean enabled = true;
        private int topK = 5;
        /** Cosine similarity below this is discarded */
        private double similarityThreshold = 0.7;
        /** Fixed for the lifetime of a similarity collection */
        private int dimensions = 768;
        /** mongo | memory */
        private String store = "mongo";
        /** Newest records scored per query by the mongo store */
        private int maxCandidates = 10_000;
    }

    @Data
    public static class Session {
        /** mongo | memory */
        private String store = "mongo";
        private Cache cache = new Cache();

        @Data
        public static class Cache {
            private boolean enabled = true;
            private long ttlMinutes = 30;
        }
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** Per external call; keep well below loop.turn-timeout */
        private Duration responseTimeout = Duration.ofSeconds(20);
        private int maxConnections = 50;
        private int maxConnectionsPerRoute = 20;
    }
}
