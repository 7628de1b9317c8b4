package com.intentflow.engine.security;

import com.intentflow.core.exception.ConfirmationTimeoutException;
import com.intentflow.core.exception.InvalidConfirmationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and redeems single-use, time-boxed confirmation tokens.
 *
 * Tokens are HMAC-signed JWTs: subject is the task id, {@code planId} is a claim and the
 * JWT id marks the token as used once it has been redeemed.
 */
public class ConfirmationTokenService {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationTokenService.class);
    private static final String PLAN_ID_CLAIM = "planId";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey signingKey;
    private final Duration ttl;
    private final Clock clock;
    private final Map<UUID, IssuedToken> pending = new ConcurrentHashMap<>();
    // used token ids until their expiry; the parser rejects them after that
    private final Map<String, Instant> redeemed = new ConcurrentHashMap<>();

    public ConfirmationTokenService(String secret, Duration ttl, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(keyBytes(secret));
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Issue a token for a plan, replacing any earlier pending token of the task.
     */
    public IssuedToken issue(UUID taskId, UUID planId) {
        // JWT dates have second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
            .subject(taskId.toString())
            .id(tokenId)
            .claim(PLAN_ID_CLAIM, planId.toString())
            .issuedAt(Date.from(now))
            .expiration(Date.from(expiresAt))
            .signWith(signingKey)
            .compact();

        IssuedToken issued = new IssuedToken(taskId, planId, tokenId, token, expiresAt);
        pending.put(taskId, issued);
        log.debug("Issued confirmation token {} for task {} (expires {})", tokenId, taskId, expiresAt);
        return issued;
    }

    /**
     * Validate and consume a token.
     *
     * @throws ConfirmationTimeoutException if the token has expired
     * @throws InvalidConfirmationException if the token is forged, used, or for another task or plan
     */
    public void redeem(UUID taskId, UUID planId, String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidConfirmationException(taskId, "missing token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        } catch (ExpiredJwtException e) {
            throw new ConfirmationTimeoutException(taskId);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidConfirmationException(taskId, "signature or format check failed");
        }

        if (!taskId.toString().equals(claims.getSubject())) {
            throw new InvalidConfirmationException(taskId, "token was issued for another task");
        }
        if (!planId.toString().equals(claims.get(PLAN_ID_CLAIM, String.class))) {
            throw new InvalidConfirmationException(taskId, "token was issued for another plan");
        }
        IssuedToken current = pending.get(taskId);
        if (current == null || !current.tokenId().equals(claims.getId())) {
            throw new InvalidConfirmationException(taskId, "token is not pending");
        }
        pruneRedeemed();
        if (redeemed.putIfAbsent(claims.getId(), claims.getExpiration().toInstant()) != null) {
            throw new InvalidConfirmationException(taskId, "token already used");
        }
        pending.remove(taskId, current);
        log.info("Confirmation token {} redeemed for task {}", claims.getId(), taskId);
    }

    public Duration ttl() {
        return ttl;
    }

    public Optional<Instant> pendingExpiry(UUID taskId) {
        return Optional.ofNullable(pending.get(taskId)).map(IssuedToken::expiresAt);
    }

    /**
     * Drop the pending token of a task, e.g. when it is cancelled or timed out.
     */
    public void revoke(UUID taskId) {
        IssuedToken removed = pending.remove(taskId);
        pruneRedeemed();
        if (removed != null) {
            redeemed.put(removed.tokenId(), removed.expiresAt());
        }
    }

    int trackedTokenCount() {
        return redeemed.size();
    }

    private void pruneRedeemed() {
        Instant now = clock.instant();
        redeemed.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
    }

    private static byte[] keyBytes(String secret) {
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length >= MIN_KEY_BYTES) {
            return raw;
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(raw);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
