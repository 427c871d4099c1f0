package com.agentcrew.providers;

import com.agentcrew.shared.retry.ResilientCall;
import com.agentcrew.shared.retry.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Retries each provider, then falls back to the next provider and then to fallback
 * models. Client errors other than 408/429 are not retried.
 */
public class ReliableProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(ReliableProvider.class);

    private final List<ModelProvider> providers;
    private final int maxRetries;
    private final long baseDelayMs;
    private final Map<String, List<String>> modelFallbacks;

    public ReliableProvider(List<ModelProvider> providers, int maxRetries, long baseDelayMs) {
        this(providers, maxRetries, baseDelayMs, Map.of());
    }

    public ReliableProvider(List<ModelProvider> providers, int maxRetries, long baseDelayMs,
                            Map<String, List<String>> modelFallbacks) {
        if (providers.isEmpty()) throw new IllegalArgumentException("At least one provider is required");
        this.providers = List.copyOf(providers);
        this.maxRetries = maxRetries;
        this.baseDelayMs = Math.max(baseDelayMs, 50);
        this.modelFallbacks = Map.copyOf(modelFallbacks);
    }

    @Override
    public String id() {
        return "reliable";
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        var failures = new ArrayList<String>();
        for (var model : modelChain(request.model())) {
            var req = request.withModel(model);
            for (int i = 0; i < providers.size(); i++) {
                var provider = providers.get(i);
                try {
                    var resp = ResilientCall.execute(() -> provider.chat(req), maxRetries, baseDelayMs);
                    if (i > 0 || !sameModel(model, request.model())) {
                        log.info("Recovered via provider={} model={}", provider.id(), model);
                    }
                    return resp;
                } catch (RuntimeException e) {
                    failures.add(provider.id() + "/" + model + ": " + rootMessage(e));
                    log.warn("Provider {} model {} failed, trying next", provider.id(), model);
                }
            }
        }
        throw new RuntimeException("All providers/models failed:\n" + String.join("\n", failures));
    }

    private List<String> modelChain(String model) {
        var chain = new ArrayList<String>();
        chain.add(model);
        var fallbacks = model == null ? null : modelFallbacks.get(model);
        if (fallbacks != null) chain.addAll(fallbacks);
        return chain;
    }

    private static boolean sameModel(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private static String rootMessage(Throwable t) {
        if (t instanceof RetriesExhaustedException && t.getCause() != null) t = t.getCause();
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }
}
