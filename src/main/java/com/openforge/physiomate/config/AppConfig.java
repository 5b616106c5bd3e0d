package com.openforge.physiomate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - agentExecutor  → chat invocations and research sub-agents
 *  - toolExecutor   → bounded pool for blocking tool calls
 *  - HttpClient     → the only HTTP engine (LLM, embeddings, Convex)
 *  - ObjectMapper   → snake_case ↔ camelCase, Java time, tolerant deserialization
 */
@Configuration
@EnableConfigurationProperties(AgentLoopProperties.class)
public class AppConfig {

    /**
     * Runs the TurnController for each chat request, and research sub-agents.
     * Cached: both are long-lived but mostly parked on network I/O. Research
     * must not share the bounded tool pool, since its own searches run there.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("agent-loop-"));
    }

    /**
     * Blocking INTERNAL tools are offloaded here so one slow search cannot
     * hold up invocations sharing the process.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor(AgentLoopProperties loopProperties) {
        return Executors.newFixedThreadPool(loopProperties.toolThreads(), namedDaemonThreads("agent-tool-"));
    }

    /**
     * Single, shared HttpClient instance; per-request read timeouts are set
     * at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
