package com.openforge.physiomate.research;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * agent:
 *   research:
 *     max-steps: 6
 *     top-k: 5
 *
 * @param maxSteps model round trips per research run
 * @param topK     results per search when the model does not ask for a count
 */
@ConfigurationProperties(prefix = "agent.research")
public record ResearchProperties(
        @DefaultValue("6") int maxSteps,
        @DefaultValue("5") int topK
) {}
