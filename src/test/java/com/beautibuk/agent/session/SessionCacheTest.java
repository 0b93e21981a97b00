package com.beautibuk.agent.session;

import com.beautibuk.agent.model.Message;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionCacheTest {

    private static final String SNAPSHOT_KEY = "agent:session:s1";
    private static final String GENERATION_KEY = "agent:session:gen:s1";

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Map<String, String> redis = new HashMap<>();
    private SessionCache cache;

    @BeforeEach
    void setUp() {
        cache = new SessionCache(redisTemplate, objectMapper, Duration.ofMinutes(30), true);
    }

    @Test
    void putThenGet_roundTripsMessagesUnderSessionKey() {
        backedByMap();
        Session session = conversation("hi", "hello");

        cache.put(session, cache.generation("s1"));

        assertThat(redis).containsKey(SNAPSHOT_KEY);
        Session restored = cache.get("s1").orElseThrow();
        assertThat(restored.getMessages()).extracting(Message::getContent).containsExactly("hi", "hello");
    }

    @Test
    void put_snapshotReadBeforeConcurrentAppend_isNotCached() {
        backedByMap();
        // Reader takes the generation, then loads a snapshot without the turn committed below
        long generation = cache.generation("s1");
        Session stale = conversation("hi", "hello");

        // A concurrent append lands and invalidates before the reader fills
        cache.evict("s1");
        cache.put(stale, generation);

        assertThat(redis).doesNotContainKey(SNAPSHOT_KEY);
        assertThat(cache.get("s1")).isEmpty();
    }

    @Test
    void put_afterAppend_withFreshGeneration_isCached() {
        backedByMap();
        cache.evict("s1");

        cache.put(conversation("hi", "hello", "again", "sure"), cache.generation("s1"));

        assertThat(redis.get(GENERATION_KEY)).isEqualTo("1");
        assertThat(cache.get("s1")).hasValueSatisfying(s -> assertThat(s.getMessages()).hasSize(4));
    }

    @Test
    void put_unknownGeneration_skipsRedis() {
        cache.put(conversation("hi", "hello"), SessionCache.UNKNOWN_GENERATION);

        verifyNoInteractions(redisTemplate);
    }

    @Test
    void generation_redisDown_isUnknown() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(GENERATION_KEY)).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(cache.generation("s1")).isEqualTo(SessionCache.UNKNOWN_GENERATION);
    }

    @Test
    void get_redisDown_isCacheMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(cache.get("s1")).isEmpty();
    }

    @Test
    void evict_bumpsGenerationThenDeletesSessionKey() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);

        cache.evict("s1");

        var order = inOrder(valueOps, redisTemplate);
        order.verify(valueOps).increment(GENERATION_KEY);
        order.verify(redisTemplate).delete(SNAPSHOT_KEY);
    }

    @Test
    void disabled_neverTouchesRedis() {
        SessionCache disabled = SessionCache.disabled();

        disabled.put(Session.empty("s1", Instant.now()), disabled.generation("s1"));
        disabled.evict("s1");

        assertThat(disabled.get("s1")).isEmpty();
        assertThat(disabled.generation("s1")).isEqualTo(SessionCache.UNKNOWN_GENERATION);
    }

    // ─── Helpers ────────────────────────────────────────────────────────────

    private Session conversation(String... contents) {
        Session session = Session.empty("s1", Instant.parse("2026-03-01T10:00:00Z"));
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < contents.length; i++) {
            messages.add(i % 2 == 0 ? Message.user(contents[i]) : Message.assistant(contents[i]));
        }
        session.setMessages(messages);
        return session;
    }

    /** Stands a HashMap in for Redis, including the fill script's compare-and-set. */
    private void backedByMap() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lenient().when(valueOps.get(anyString())).thenAnswer(inv -> redis.get(inv.<String>getArgument(0)));
        lenient().when(valueOps.increment(anyString())).thenAnswer(inv ->
                Long.parseLong(redis.merge(inv.getArgument(0), "1",
                        (old, one) -> String.valueOf(Long.parseLong(old) + 1))));
        lenient().when(redisTemplate.delete(anyString())).thenAnswer(inv -> redis.remove(inv.<String>getArgument(0)) != null);
        lenient().when(redisTemplate.execute(eq(SessionCache.FILL_SCRIPT), anyList(), any(Object[].class)))
                .thenAnswer(inv -> {
                    List<String> keys = inv.getArgument(1);
                    String expected = inv.getArgument(2);
                    if (!redis.getOrDefault(keys.get(1), "0").equals(expected)) {
                        return 0L;
                    }
                    redis.put(keys.get(0), inv.getArgument(3));
                    return 1L;
                });
    }
}
