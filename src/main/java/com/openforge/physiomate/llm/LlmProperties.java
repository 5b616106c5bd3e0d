package com.openforge.physiomate.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * agent:
 *   llm:
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o
 *       timeout-seconds: 120
 *     fallback:
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: sk-...
 *       model: deepseek-chat
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
