package com.agentcrew.gateway.http;

/** Body of member add and update calls. A null position appends on add and keeps the old one on update. */
public record MemberRequest(
    String agentId,
    String role,
    Integer position
) {}
