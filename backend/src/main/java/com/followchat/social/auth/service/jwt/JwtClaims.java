package com.followchat.social.auth.service.jwt;

import java.time.Instant;

public record JwtClaims(
        String username,
        Instant issuedAt,
        Instant expiresAt
) {
}
