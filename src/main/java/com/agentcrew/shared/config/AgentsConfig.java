package com.agentcrew.shared.config;

import com.agentcrew.shared.retry.RetryPolicy;

/** Retry and Direct Line polling settings shared by every agent call. */
public record AgentsConfig(
    RetryPolicy retry,
    String directLineBaseUrl,
    String defaultSecret,
    int pollAttempts,
    long pollIntervalMs
) {
    public static final String DIRECT_LINE_BASE_URL = "https://directline.botframework.com/v3/directline";

    public static AgentsConfig defaults() {
        return new AgentsConfig(RetryPolicy.defaults(), DIRECT_LINE_BASE_URL, "", 20, 1000);
    }
}
