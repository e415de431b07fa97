package com.taskpilot.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;

/**
 * Signs bearer tokens the way the identity layer does, for tests only.
 */
public final class TestTokens {

    private TestTokens() {
    }

    public static String issue(String secret, String userId) {
        return issue(secret, userId, Duration.ofHours(1));
    }

    public static String issue(String secret, String userId, Duration validity) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userId)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + validity.toMillis()))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
