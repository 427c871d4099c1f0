package com.agentcrew.providers;

/**
 * Non-2xx answer from a chat-completions endpoint. The status code is part of the message
 * so retry classification can read it.
 */
public class ModelApiException extends RuntimeException {

    private final int status;

    public ModelApiException(int status, String body) {
        super("Model API error " + status + ": " + body);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
