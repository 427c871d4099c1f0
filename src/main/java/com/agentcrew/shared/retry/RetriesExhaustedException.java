package com.agentcrew.shared.retry;

public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Exception last) {
        super("All retries exhausted", last);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
