package com.livemart.marketplace.security;

import com.livemart.marketplace.entity.User;
import com.livemart.marketplace.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256-signed, time-boxed bearer tokens. The subject is the user's email and
 * the {@code user_id} claim carries the user identifier.
 */
@Component
public class JwtTokenProvider {

    static final String USER_ID_CLAIM = "user_id";

    private final SecretKey key;
    private final Duration tokenTtl;

    public JwtTokenProvider(@Value("${marketplace.auth.secret}") String secret,
                            @Value("${marketplace.auth.token-ttl:7d}") Duration tokenTtl) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = tokenTtl;
    }

    public String issue(User user) {
        return issue(user.getId(), user.getEmail(), Instant.now());
    }

    String issue(String userId, String email, Instant issuedAt) {
        return Jwts.builder()
                .subject(email)
                .claim(USER_ID_CLAIM, userId)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(tokenTtl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public AuthenticatedUser verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String userId = claims.get(USER_ID_CLAIM, String.class);
            if (userId == null) {
                throw new UnauthorizedException("Token carries no user identity");
            }
            return new AuthenticatedUser(userId, claims.getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid or expired token");
        }
    }
}
