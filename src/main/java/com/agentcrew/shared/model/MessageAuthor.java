package com.agentcrew.shared.model;

public enum MessageAuthor {
    SYSTEM,
    AGENT,
    USER
}
