package com.openforge.physiomate.config;

import com.openforge.physiomate.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * Two named instances are pre-wired, one per LLM provider:
 *   • "primaryLlm"
 *   • "fallbackLlm"
 *
 * LlmRouter tries primaryLlm first; if the circuit is OPEN or the call keeps
 * failing it falls through to fallbackLlm.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // a whole streamed turn can legitimately take a while
                .slowCallDurationThreshold(Duration.ofSeconds(90))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(LlmClient.LlmException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // a stream that already delivered chunks must never be replayed
                .retryOnException(e -> e instanceof LlmClient.LlmException
                        && !(e instanceof LlmClient.LlmStreamInterruptedException))
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }
}
