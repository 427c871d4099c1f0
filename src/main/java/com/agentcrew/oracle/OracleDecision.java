package com.agentcrew.oracle;

/** An {@link Action} plus the model usage that produced it. */
public record OracleDecision(
    Action action,
    String model,
    int promptTokens,
    int completionTokens
) implements ModelUsage {
    public static OracleDecision of(Action action) {
        return new OracleDecision(action, null, 0, 0);
    }
}
