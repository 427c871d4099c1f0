package com.agentcrew.oracle;

import com.agentcrew.capability.CapabilitySet;

import java.util.List;

/** The part of a capability the oracle may see. It cannot be invoked. */
public record CapabilityDescriptor(String name, String agentId, String description) {

    public static List<CapabilityDescriptor> of(CapabilitySet capabilities) {
        return capabilities.all().stream()
                .map(c -> new CapabilityDescriptor(c.functionName(), c.agentId(), c.description()))
                .toList();
    }
}
