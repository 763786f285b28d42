package com.relaydesk.support.auth.service.jwt;

public record JwtClaims(
        String userId,
        String tenantId,
        String role,
        String username
) {

    public boolean isAdmin() {
        return "admin".equals(role);
    }

    public boolean isManagerOrAdmin() {
        return "admin".equals(role) || "manager".equals(role);
    }
}
