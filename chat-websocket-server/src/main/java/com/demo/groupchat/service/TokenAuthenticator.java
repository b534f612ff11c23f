package com.demo.groupchat.service;

import com.demo.groupchat.domain.UserAccount;
import com.demo.groupchat.repository.UserAccountRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * Bearer token verification.
 * <p>
 * Tokens are HMAC-signed JWTs carrying the numeric user id in a {@code user_id} claim
 * (the subject is accepted as a fallback). A token only authenticates an existing,
 * active user account.
 */
@Service
@Slf4j
public class TokenAuthenticator {

    private static final String USER_ID_CLAIM = "user_id";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final UserAccountRepository userRepository;
    private final MetricsService metricsService;

    public TokenAuthenticator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            UserAccountRepository userRepository,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.userRepository = userRepository;
        this.metricsService = metricsService;
    }

    /**
     * Resolve a token to an active user, or empty for any invalid, expired or unknown token
     */
    public Optional<UserAccount> authenticate(String token) {
        Optional<Long> userId = extractUserId(token);
        Optional<UserAccount> user = userId.flatMap(userRepository::findByIdAndActiveTrue);

        if (userId.isPresent() && user.isEmpty()) {
            log.warn("Token for unknown or inactive user: userId={}", userId.get());
        }
        metricsService.recordAuthenticationAttempt(user.isPresent());
        return user;
    }

    /**
     * Verify signature and expiry and read the user id, without touching the user store
     */
    public Optional<Long> extractUserId(String token) {
        if (token == null || token.isBlank()) {
            log.warn("Empty token provided");
            return Optional.empty();
        }
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length());
        }

        try {
            Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();

            Object claim = claims.get(USER_ID_CLAIM);
            String raw = claim != null ? claim.toString() : claims.getSubject();
            if (raw == null) {
                log.warn("Token carries no user id");
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(raw));

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
            return Optional.empty();
        } catch (JwtException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            log.warn("Unreadable JWT token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Issue a token (for testing/development)
     */
    public String generateToken(Long userId) {
        return Jwts.builder()
            .subject(String.valueOf(userId))
            .claim(USER_ID_CLAIM, userId)
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}
