package com.followchat.social.chat.ws;

import com.followchat.social.auth.service.jwt.JwtService;
import com.followchat.social.user.repo.UserAccountRepository;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the connecting user before the upgrade. The handshake always proceeds; anything
 * short of a valid token for an existing user leaves the connection anonymous and the handler
 * closes it with 4001.
 */
@Component
public class WsHandshakeAuthenticator implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(WsHandshakeAuthenticator.class);

    static final String QUERY_TOKEN = "token";

    private final JwtService jwtService;
    private final UserAccountRepository userAccountRepository;
    private final String cookieName;

    public WsHandshakeAuthenticator(
            JwtService jwtService,
            UserAccountRepository userAccountRepository,
            @Value("${app.ws.access-cookie-name:access_token}") String cookieName
    ) {
        this.jwtService = jwtService;
        this.userAccountRepository = userAccountRepository;
        this.cookieName = cookieName;
    }

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes
    ) {
        attributes.put(ConnectionIdentity.ATTRIBUTE, resolve(request));
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception
    ) {
    }

    ConnectionIdentity resolve(ServerHttpRequest request) {
        var token = cookieToken(request.getHeaders()).or(() -> queryToken(request));
        if (token.isEmpty()) {
            return ConnectionIdentity.ANONYMOUS;
        }

        try {
            var claims = jwtService.parse(token.get());
            if (!userAccountRepository.existsUsername(claims.username())) {
                log.debug("ws_auth_unknown_subject username={}", claims.username());
                return ConnectionIdentity.ANONYMOUS;
            }
            return ConnectionIdentity.of(claims.username());
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("ws_auth_invalid_token reason={}", ex.getMessage());
            return ConnectionIdentity.ANONYMOUS;
        } catch (DataAccessException ex) {
            log.warn("ws_auth_lookup_failed", ex);
            return ConnectionIdentity.ANONYMOUS;
        }
    }

    private Optional<String> cookieToken(HttpHeaders headers) {
        var values = headers.get(HttpHeaders.COOKIE);
        if (values == null) return Optional.empty();
        for (var header : values) {
            for (var pair : header.split(";")) {
                var idx = pair.indexOf('=');
                if (idx <= 0) continue;
                var name = pair.substring(0, idx).trim();
                var value = pair.substring(idx + 1).trim();
                if (cookieName.equals(name) && !value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> queryToken(ServerHttpRequest request) {
        var raw = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(QUERY_TOKEN);
        if (raw == null || raw.isBlank()) return Optional.empty();
        return Optional.of(UriUtils.decode(raw, StandardCharsets.UTF_8));
    }
}
