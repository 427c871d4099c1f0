package com.agentcrew.shared.error;

/**
 * Base of every failure the orchestration engine knows how to classify.
 */
public class CrewException extends RuntimeException {

    private final FailureCause cause;

    public CrewException(FailureCause cause, String message) {
        super(message);
        this.cause = cause;
    }

    public CrewException(FailureCause cause, String message, Throwable throwable) {
        super(message, throwable);
        this.cause = cause;
    }

    public FailureCause failureCause() {
        return cause;
    }
}
