package com.agentcrew.capability;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered dispatch table from function name to capability.
 */
public class CapabilitySet {

    private final Map<String, AgentCapability> byName;

    CapabilitySet(List<AgentCapability> capabilities) {
        var map = new LinkedHashMap<String, AgentCapability>();
        for (var c : capabilities) {
            if (map.putIfAbsent(c.functionName(), c) != null) {
                throw new IllegalArgumentException("Duplicate capability: " + c.functionName());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public AgentCapability get(String functionName) {
        return byName.get(functionName);
    }

    public Collection<AgentCapability> all() {
        return byName.values();
    }

    public List<String> names() {
        return List.copyOf(byName.keySet());
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    /** Copy whose capabilities hold their own, empty sessions. */
    public CapabilitySet fork() {
        return new CapabilitySet(byName.values().stream().map(AgentCapability::fork).toList());
    }
}
