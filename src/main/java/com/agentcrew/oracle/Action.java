package com.agentcrew.oracle;

/**
 * What the oracle wants next: call one capability, or stop with an answer.
 */
public interface Action {

    record Invoke(String capability, String message, String reasoning) implements Action {
        public Invoke {
            if (capability == null || capability.isBlank()) {
                throw new IllegalArgumentException("capability must not be blank");
            }
            if (message == null) message = "";
        }
    }

    record Conclude(String answer) implements Action {
        public Conclude {
            if (answer == null) answer = "";
        }
    }
}
