package com.openforge.physiomate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Bounds and knobs of the tool-calling loop.
 *
 * agent:
 *   loop:
 *     max-turns: 10
 *     max-tokens: 4096
 *     substep-poll-interval: 100ms
 *     max-argument-chars: 65536
 *     max-tool-calls: 64
 *     tool-threads: 16
 *
 * @param maxTurns            model turns per invocation
 * @param maxTokens           completion token budget per turn
 * @param temperature         sampling temperature; null leaves the provider default
 * @param substepPollInterval wait-with-timeout interval of the sub-agent drain loop
 * @param maxArgumentChars    ceiling on one tool call's argument text
 * @param maxToolCalls        ceiling on executed tool calls across one invocation
 * @param toolThreads         size of the blocking-tool worker pool
 */
@ConfigurationProperties(prefix = "agent.loop")
public record AgentLoopProperties(
        @DefaultValue("10")     int      maxTurns,
        @DefaultValue("4096")   int      maxTokens,
        Double                           temperature,
        @DefaultValue("100ms")  Duration substepPollInterval,
        @DefaultValue("65536")  int      maxArgumentChars,
        @DefaultValue("64")     int      maxToolCalls,
        @DefaultValue("16")     int      toolThreads
) {

    public static AgentLoopProperties defaults() {
        return new AgentLoopProperties(10, 4096, null, Duration.ofMillis(100), 65_536, 64, 16);
    }

    public AgentLoopProperties withMaxTurns(int turns) {
        return new AgentLoopProperties(turns, maxTokens, temperature, substepPollInterval,
                maxArgumentChars, maxToolCalls, toolThreads);
    }
}
