package com.agentcrew.providers;

/** A function call requested by the model; {@code arguments} is the raw JSON string. */
public record ToolCallInfo(String id, String name, String arguments) {}
