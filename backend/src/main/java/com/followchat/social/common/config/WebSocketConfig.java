package com.followchat.social.common.config;

import com.followchat.social.chat.ws.WsHandler;
import com.followchat.social.chat.ws.WsHandshakeAuthenticator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.ArrayList;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WsHandler wsHandler;
    private final WsHandshakeAuthenticator handshakeAuthenticator;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            WsHandler wsHandler,
            WsHandshakeAuthenticator handshakeAuthenticator,
            @Value("${app.ws.allowed-origins:*}") String allowedOriginsCsv
    ) {
        this.wsHandler = wsHandler;
        this.handshakeAuthenticator = handshakeAuthenticator;
        this.allowedOrigins = parseOrigins(allowedOriginsCsv);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(wsHandler, "/ws/chat/*", "/ws/chat/*/")
                .addInterceptors(handshakeAuthenticator)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    private static String[] parseOrigins(String csv) {
        var out = new ArrayList<String>();
        if (csv != null) {
            for (var raw : csv.split(",")) {
                var t = raw.trim();
                if (!t.isBlank()) out.add(t);
            }
        }
        if (out.isEmpty()) out.add("*");
        return out.toArray(new String[0]);
    }
}
