package com.openforge.physiomate.workout;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Workout plan generation settings.
 *
 * agent:
 *   workout:
 *     temperature: 0.5
 *     max-tokens: 4096
 *     images:
 *       enabled: false
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: dall-e-3
 *       size: 1024x1024
 *       timeout-seconds: 60
 *
 * With images disabled every exercise is returned with a null imageUrl.
 */
@ConfigurationProperties(prefix = "agent.workout")
public record WorkoutProperties(
        @DefaultValue("0.5") double temperature,
        @DefaultValue("4096") int maxTokens,
        @DefaultValue Images images
) {

    public record Images(
            @DefaultValue("false") boolean enabled,
            String baseUrl,
            String apiKey,
            @DefaultValue("dall-e-3") String model,
            @DefaultValue("1024x1024") String size,
            @DefaultValue("60") int timeoutSeconds
    ) {}
}
