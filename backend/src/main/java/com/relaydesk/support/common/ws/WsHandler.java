package com.relaydesk.support.common.ws;

import com.relaydesk.support.auth.service.jwt.JwtClaims;
import com.relaydesk.support.auth.service.jwt.JwtService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@Component
public class WsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsHandler.class);

    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final WsSessionRegistry sessionRegistry;
    private final WsBroadcaster broadcaster;

    public WsHandler(
            ObjectMapper objectMapper,
            JwtService jwtService,
            WsSessionRegistry sessionRegistry,
            WsBroadcaster broadcaster
    ) {
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        broadcaster.register(session);

        // Optional: token in query string, e.g. /ws/agent?token=...&client=web
        var params = parseQueryParams(session.getUri());
        var token = params.get("token");
        if (token == null || token.isBlank()) {
            return;
        }
        try {
            bindAuthenticated(session, jwtService.parse(token), params.getOrDefault("client", "unknown"));
        } catch (ExpiredJwtException ex) {
            sendErrorQuietly(session, "token_expired");
            closeQuietly(session, CloseStatus.NOT_ACCEPTABLE);
        } catch (Exception ex) {
            sendErrorQuietly(session, "invalid_token");
            closeQuietly(session, CloseStatus.NOT_ACCEPTABLE);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.unregister(session);
        sessionRegistry.unbind(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        final String rid = "ws_" + session.getId() + "_" + System.nanoTime();
        try {
            JsonNode root = objectMapper.readTree(message.getPayload());
            var type = root.path("type").asText(null);
            if (type == null) {
                sendError(session, "missing_type", rid);
                return;
            }

            switch (type) {
                case "AUTH" -> handleAuth(session, root);
                case "PING" -> broadcaster.send(session, obj("type", "PONG"));
                default -> sendError(session, "unsupported_type", rid);
            }
        } catch (IllegalArgumentException ex) {
            sendError(session, ex.getMessage(), rid);
        } catch (Exception ex) {
            log.warn("ws_internal_error rid={} sessionId={}", rid, session.getId(), ex);
            sendError(session, "ws_internal_error", rid);
        }
    }

    private void handleAuth(WebSocketSession session, JsonNode root) throws IOException {
        var token = root.path("token").asText(null);
        if (token == null || token.isBlank()) {
            sendError(session, "missing_token", null);
            return;
        }
        final JwtClaims claims;
        try {
            claims = jwtService.parse(token);
        } catch (ExpiredJwtException ex) {
            sendError(session, "token_expired", null);
            closeQuietly(session, CloseStatus.NOT_ACCEPTABLE);
            return;
        } catch (JwtException ex) {
            sendError(session, "invalid_token", null);
            closeQuietly(session, CloseStatus.NOT_ACCEPTABLE);
            return;
        }
        bindAuthenticated(session, claims, root.path("client").asText("unknown"));
    }

    private void bindAuthenticated(WebSocketSession session, JwtClaims claims, String client) throws IOException {
        sessionRegistry.bind(session, new WsSessionRegistry.SessionContext(claims, client));

        ObjectNode ok = objectMapper.createObjectNode();
        ok.put("type", "AUTH_OK");
        ok.put("user_id", claims.userId());
        ok.put("role", claims.role());
        ok.put("tenant_id", claims.tenantId());
        broadcaster.send(session, ok);
    }

    private ObjectNode obj(String k, String v) {
        ObjectNode n = objectMapper.createObjectNode();
        n.put(k, v);
        return n;
    }

    private void sendError(WebSocketSession session, String code, String rid) throws IOException {
        ObjectNode err = objectMapper.createObjectNode();
        err.put("type", "ERROR");
        err.put("code", code == null ? "error" : code);
        if (rid != null) {
            err.put("rid", rid);
        }
        broadcaster.send(session, err);
    }

    private void sendErrorQuietly(WebSocketSession session, String code) {
        try {
            sendError(session, code, null);
        } catch (Exception e) {
            log.debug("ws_error_send_failed sessionId={} code={}", session.getId(), code);
        }
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (Exception e) {
            log.debug("ws_close_failed sessionId={}", session.getId());
        }
    }

    private static Map<String, String> parseQueryParams(URI uri) {
        var out = new HashMap<String, String>();
        if (uri == null || uri.getRawQuery() == null) return out;
        for (var pair : uri.getRawQuery().split("&")) {
            if (pair.isBlank()) continue;
            var idx = pair.indexOf('=');
            var k = idx < 0 ? pair : pair.substring(0, idx);
            var v = idx < 0 ? "" : pair.substring(idx + 1);
            out.put(URLDecoder.decode(k, StandardCharsets.UTF_8), URLDecoder.decode(v, StandardCharsets.UTF_8));
        }
        return out;
    }
}
