package com.intentflow.engine.security;

import java.time.Instant;
import java.util.UUID;

/**
 * A confirmation token handed out for one plan of one task.
 */
public record IssuedToken(
    UUID taskId,
    UUID planId,
    String tokenId,
    String token,
    Instant expiresAt
) {
}
