package com.agentcrew.oracle;

import java.util.List;

/**
 * An up-front plan. {@code fallback} is set when the model's answer could not be parsed
 * and a single default step was substituted.
 */
public record PlanDraft(
    List<PlanStep> steps,
    boolean fallback,
    String model,
    int promptTokens,
    int completionTokens
) implements ModelUsage {
    public PlanDraft {
        steps = List.copyOf(steps);
    }
}
