package com.relaydesk.support.common.ws;

import com.relaydesk.support.auth.service.jwt.JwtClaims;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class WsSessionRegistry {

    public record SessionContext(JwtClaims claims, String client) {
    }

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tenantSessionIds = new ConcurrentHashMap<>();

    public void bind(WebSocketSession session, SessionContext ctx) {
        var previous = sessions.put(session.getId(), ctx);
        if (previous != null && previous.claims() != null) {
            removeFromTenant(previous.claims().tenantId(), session.getId());
        }
        if (ctx != null && ctx.claims() != null && ctx.claims().tenantId() != null) {
            tenantSessionIds.computeIfAbsent(ctx.claims().tenantId(), k -> ConcurrentHashMap.newKeySet())
                    .add(session.getId());
        }
    }

    public Optional<SessionContext> get(WebSocketSession session) {
        return Optional.ofNullable(sessions.get(session.getId()));
    }

    public void unbind(WebSocketSession session) {
        var ctx = sessions.remove(session.getId());
        if (ctx != null && ctx.claims() != null) {
            removeFromTenant(ctx.claims().tenantId(), session.getId());
        }
    }

    public Set<String> getTenantSessionIds(String tenantId) {
        if (tenantId == null) return Collections.emptySet();
        return tenantSessionIds.getOrDefault(tenantId, Collections.emptySet());
    }

    private void removeFromTenant(String tenantId, String sessionId) {
        if (tenantId == null) return;
        tenantSessionIds.computeIfPresent(tenantId, (k, set) -> {
            set.remove(sessionId);
            return set.isEmpty() ? null : set;
        });
    }
}
