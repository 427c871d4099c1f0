package com.agentcrew.capability;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers the conversation token the remote agent handed back on its last reply.
 */
public final class SessionHolder {

    private final AtomicReference<String> token = new AtomicReference<>();

    public String get() {
        return token.get();
    }

    void set(String value) {
        if (value != null) token.set(value);
    }
}
