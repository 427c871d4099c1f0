package com.agentcrew.telemetry;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CostEstimatorTest {

    @Test
    void pricesKnownModels() {
        var estimator = new CostEstimator();
        assertEquals(2.5 + 10.0, estimator.estimate("gpt-4o", 1_000_000, 1_000_000), 1e-9);
        assertEquals(0.15, estimator.estimate("GPT-4o-mini", 1_000_000, 0), 1e-9);
    }

    @Test
    void unknownOrMissingModelIsFree() {
        var estimator = new CostEstimator();
        assertEquals(0.0, estimator.estimate("llama3", 5000, 5000));
        assertEquals(0.0, estimator.estimate(null, 5000, 5000));
    }

    @Test
    void overridesReplaceDefaults() {
        var estimator = new CostEstimator(Map.of("Llama3", new double[]{1.0, 2.0}, "gpt-4o", new double[]{0, 0}));
        assertEquals(3.0, estimator.estimate("llama3", 1_000_000, 1_000_000), 1e-9);
        assertEquals(0.0, estimator.estimate("gpt-4o", 1_000_000, 1_000_000));
    }
}
