package com.relaydesk.support.common.config;

import com.relaydesk.support.common.ws.WsHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WsHandler wsHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            WsHandler wsHandler,
            @Value("${app.ws.allowed-origins:*}") String allowedOriginsCsv
    ) {
        this.wsHandler = wsHandler;
        this.allowedOrigins = allowedOriginsCsv == null || allowedOriginsCsv.isBlank()
                ? new String[]{"*"}
                : allowedOriginsCsv.split("\\s*,\\s*");
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(wsHandler, "/ws/agent").setAllowedOriginPatterns(allowedOrigins);
    }
}
