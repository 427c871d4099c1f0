package com.agentcrew.oracle;

public record PlanStep(String capability, String message, String reasoning) {}
