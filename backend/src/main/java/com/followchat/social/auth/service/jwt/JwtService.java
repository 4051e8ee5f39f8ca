package com.followchat.social.auth.service.jwt;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

@Service
public class JwtService {

    private static final String TOKEN_TYPE_CLAIM = "token_type";
    private static final String ACCESS = "access";

    private final SecretKey key;

    public JwtService(@Value("${app.jwt.secret:dev-secret-change-me-please-32bytes-min}") String secret) {
        var bytes = secret.getBytes(StandardCharsets.UTF_8);
        this.key = Keys.hmacShaKeyFor(bytes);
    }

    public String issueAccessToken(String username, Duration ttl) {
        var now = Instant.now();
        var exp = now.plus(ttl);

        return Jwts.builder()
                .setSubject(username)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .claim(TOKEN_TYPE_CLAIM, ACCESS)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verifies signature and expiry.
     *
     * @throws io.jsonwebtoken.ExpiredJwtException when the token is past its expiry
     * @throws JwtException for any other invalid token
     */
    public JwtClaims parse(String token) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();

        if (!ACCESS.equals(claims.get(TOKEN_TYPE_CLAIM))) {
            throw new JwtException("not an access token");
        }
        var subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new JwtException("missing subject");
        }
        var issuedAt = claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant();
        var expiresAt = claims.getExpiration() == null ? null : claims.getExpiration().toInstant();
        return new JwtClaims(subject, issuedAt, expiresAt);
    }

    public static Optional<String> extractBearerToken(String authorization) {
        if (authorization == null || authorization.isBlank()) return Optional.empty();
        var prefix = "Bearer ";
        if (!authorization.startsWith(prefix)) return Optional.empty();
        var token = authorization.substring(prefix.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
