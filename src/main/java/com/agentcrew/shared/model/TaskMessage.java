package com.agentcrew.shared.model;

import java.time.Instant;

/**
 * One transcript entry. {@code sequence} is strictly increasing per task.
 * {@code authorName} is the capability name for agent messages and null otherwise.
 */
public record TaskMessage(
    String taskId,
    long sequence,
    MessageAuthor author,
    String authorName,
    String content,
    Instant timestamp
) {}
