package com.relaydesk.support.common.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class WsBroadcaster implements OrgNotifier {

    private static final Logger log = LoggerFactory.getLogger(WsBroadcaster.class);

    private final ObjectMapper objectMapper;
    private final WsSessionRegistry sessionRegistry;

    private final Map<String, WebSocketSession> liveSessions = new ConcurrentHashMap<>();

    public WsBroadcaster(ObjectMapper objectMapper, WsSessionRegistry sessionRegistry) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
    }

    public void register(WebSocketSession session) {
        if (session == null) return;
        liveSessions.put(session.getId(), session);
    }

    public void unregister(WebSocketSession session) {
        if (session == null) return;
        liveSessions.remove(session.getId());
    }

    /**
     * Every agent, manager and admin session of the tenant receives the event; there is no per-user targeting.
     */
    @Override
    public void notifyOrg(String tenantId, String eventType, ObjectNode payload) {
        if (tenantId == null || tenantId.isBlank()) return;
        if (eventType == null || eventType.isBlank()) return;

        ObjectNode evt = objectMapper.createObjectNode();
        evt.put("type", eventType);
        evt.put("created_at", Instant.now().getEpochSecond());
        evt.set("payload", payload == null ? objectMapper.createObjectNode() : payload);

        for (var sessionId : sessionRegistry.getTenantSessionIds(tenantId)) {
            var s = liveSessions.get(sessionId);
            if (s == null) continue;
            var ctx = sessionRegistry.get(s).orElse(null);
            if (ctx == null || ctx.claims() == null) continue;
            var role = ctx.claims().role();
            if (!"agent".equals(role) && !"manager".equals(role) && !"admin".equals(role)) continue;
            try {
                send(s, evt);
            } catch (IOException e) {
                log.debug("ws_send_failed sessionId={} type={} cause={}", sessionId, eventType, e.toString());
            }
        }
    }

    void send(WebSocketSession session, JsonNode node) throws IOException {
        if (session == null || node == null) return;
        if (!session.isOpen()) return;
        // WebSocketSession#sendMessage is not safe for concurrent writers.
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(node)));
        }
    }
}
