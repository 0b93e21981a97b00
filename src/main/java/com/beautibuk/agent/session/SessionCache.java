package com.beautibuk.agent.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis read-through cache of session snapshots in front of the session store.
 *
 * - Key pattern: agent:session:{sessionId}
 * - Stored as a single JSON document, TTL reset on every fill
 * - Every append bumps agent:session:gen:{sessionId} and then evicts the snapshot
 * - A fill carries the generation read before the store was queried and is dropped
 *   if an append has bumped it since, so a snapshot older than the store is never cached
 * - Never the source of truth: any Redis or serialization failure is a cache miss
 */
@Slf4j
public class SessionCache {

    /** Generation of a session whose counter could not be read; fills carrying it are skipped. */
    public static final long UNKNOWN_GENERATION = -1;

    private static final String KEY_PREFIX = "agent:session:";
    private static final String GENERATION_PREFIX = "agent:session:gen:";

    // KEYS[1] snapshot, KEYS[2] generation; ARGV expected generation, snapshot json, ttl millis
    static final RedisScript<Long> FILL_SCRIPT = RedisScript.of("""
            if (redis.call('GET', KEYS[2]) or '0') == ARGV[1] then
              redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
              return 1
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final boolean enabled;

    public SessionCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                        Duration ttl, boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.enabled = enabled;
    }

    public static SessionCache disabled() {
        return new SessionCache(null, null, Duration.ZERO, false);
    }

    public Optional<Session> get(String sessionId) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.opsForValue().get(buildKey(sessionId));
            if (json == null) {
                return Optional.empty();
            }
            Session session = objectMapper.readValue(json, Session.class);
            log.debug("Session cache hit [sessionId={}, messages={}]", sessionId, session.getMessages().size());
            return Optional.of(session);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Session cache read failed for {}, falling back to store: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Current write generation of a session. Read it before querying the store and hand it
     * to {@link #put(Session, long)} with the snapshot that query returned.
     */
    public long generation(String sessionId) {
        if (!enabled) {
            return UNKNOWN_GENERATION;
        }
        try {
            String value = redisTemplate.opsForValue().get(buildGenerationKey(sessionId));
            return value != null ? Long.parseLong(value) : 0;
        } catch (DataAccessException | NumberFormatException e) {
            log.warn("Session generation read failed for {}, skipping fill: {}", sessionId, e.getMessage());
            return UNKNOWN_GENERATION;
        }
    }

    /**
     * Caches {@code session} only if no append happened since {@code generation} was read.
     */
    public void put(Session session, long generation) {
        if (!enabled || generation == UNKNOWN_GENERATION) {
            return;
        }
        String sessionId = session.getSessionId();
        try {
            Long stored = redisTemplate.execute(FILL_SCRIPT,
                    List.of(buildKey(sessionId), buildGenerationKey(sessionId)),
                    String.valueOf(generation),
                    objectMapper.writeValueAsString(session),
                    String.valueOf(ttl.toMillis()));
            if (stored == null || stored == 0) {
                log.debug("Session cache fill dropped, appended since generation {} [sessionId={}]",
                        generation, sessionId);
            }
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Session cache fill failed for {}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Called after every store write: bumps the generation first so in-flight fills are refused,
     * then drops the snapshot.
     */
    public void evict(String sessionId) {
        if (!enabled) {
            return;
        }
        String generationKey = buildGenerationKey(sessionId);
        try {
            redisTemplate.opsForValue().increment(generationKey);
            redisTemplate.expire(generationKey, ttl);
            redisTemplate.delete(buildKey(sessionId));
        } catch (DataAccessException e) {
            // A stale entry would outlive the write; surface it loudly, the TTL bounds the damage
            log.error("Session cache eviction failed for {}: {}", sessionId, e.getMessage());
        }
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    private String buildGenerationKey(String sessionId) {
        return GENERATION_PREFIX + sessionId;
    }
}
