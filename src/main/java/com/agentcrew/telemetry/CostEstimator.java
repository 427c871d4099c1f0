package com.agentcrew.telemetry;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public class CostEstimator {

    // price per 1M tokens (USD): {prompt, completion}
    private static final Map<String, double[]> DEFAULT_PRICING = Map.of(
            "gpt-4", new double[]{30.0, 60.0},
            "gpt-4o", new double[]{2.5, 10.0},
            "gpt-4o-mini", new double[]{0.15, 0.6},
            "gpt-3.5-turbo", new double[]{1.5, 2.0},
            "deepseek-chat", new double[]{0.14, 0.28}
    );

    private final Map<String, double[]> pricing;

    public CostEstimator() {
        this(Map.of());
    }

    public CostEstimator(Map<String, double[]> overrides) {
        var merged = new HashMap<String, double[]>();
        DEFAULT_PRICING.forEach((k, v) -> merged.put(k, v.clone()));
        overrides.forEach((k, v) -> merged.put(k.toLowerCase(Locale.ROOT), v.clone()));
        this.pricing = Map.copyOf(merged);
    }

    public double estimate(String model, int promptTokens, int completionTokens) {
        if (model == null) return 0.0;
        var prices = pricing.get(model.toLowerCase(Locale.ROOT));
        if (prices == null) return 0.0;
        return (promptTokens * prices[0] + completionTokens * prices[1]) / 1_000_000.0;
    }
}
