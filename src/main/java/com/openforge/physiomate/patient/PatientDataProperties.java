package com.openforge.physiomate.patient;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * agent:
 *   patient:
 *     convex-url: ${CONVEX_URL:}
 *     timeout-seconds: 15
 *
 * @param convexUrl deployment URL, e.g. https://patient-possum-187.convex.cloud
 */
@ConfigurationProperties(prefix = "agent.patient")
public record PatientDataProperties(
        String convexUrl,
        @DefaultValue("15") int timeoutSeconds
) {

    public boolean configured() {
        return convexUrl != null && !convexUrl.isBlank();
    }
}
