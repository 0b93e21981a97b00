package com.beautibuk.agent.resilience;

import com.beautibuk.agent.exception.ProviderUnavailableException;
import com.beautibuk.agent.exception.TurnDeadlineExceededException;
import com.beautibuk.agent.llm.LlmClient;
import com.beautibuk.agent.model.LlmResponse;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorator around the active LlmClient that adds retry + circuit breaker.
 *
 * Retry config (resilience4j.retry.instances.llmClient in application.yml):
 * - 3 attempts, exponential backoff from 500ms
 * - Retries ProviderUnavailableException only; configuration errors (bad key, 400) pass straight through
 *
 * Circuit breaker config (resilience4j.circuitbreaker.instances.llmClient):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 *
 * Exhausted retries and an open circuit both surface as ProviderUnavailableException;
 * the orchestrator turns that into the degraded reply.
 *
 * With a turn deadline, no attempt starts once it has passed: the call fails with
 * TurnDeadlineExceededException instead of sleeping through further backoff.
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public ResilientLlmClient(LlmClient delegate, Retry retry, CircuitBreaker circuitBreaker, Clock clock) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        return chat(messages, tools, null);
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, Instant deadline) {
        Supplier<LlmResponse> call = CircuitBreaker.decorateSupplier(circuitBreaker,
                () -> delegate.chat(messages, tools));
        Supplier<LlmResponse> bounded = () -> {
            if (deadline != null && clock.instant().isAfter(deadline)) {
                throw new TurnDeadlineExceededException("Turn deadline " + deadline + " passed before completion attempt");
            }
            return call.get();
        };
        Supplier<LlmResponse> retrying = Retry.decorateSupplier(retry, bounded);

        try {
            return retrying.get();
        } catch (CallNotPermittedException e) {
            log.error("LLM circuit breaker is OPEN, rejecting call: {}", e.getMessage());
            throw new ProviderUnavailableException("The completion provider circuit is open", e);
        } catch (ProviderUnavailableException e) {
            log.error("LLM call failed after {} attempt(s): {}",
                    retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw e;
        }
    }
}
