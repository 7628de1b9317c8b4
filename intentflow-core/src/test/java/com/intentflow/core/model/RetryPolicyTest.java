package com.intentflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldAllowThreeAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.backoffBase());
        assertEquals(2.0, policy.backoffMultiplier());
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(5)
            .backoffBase(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofMinutes(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0)
            .build();

        assertEquals(Duration.ofSeconds(1), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(2), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(4), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .backoffBase(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .jitterFactor(0.0)
            .build();

        // 2^4 = 16s, capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_withJitter_shouldStayWithinRange() {
        RetryPolicy policy = RetryPolicy.builder()
            .backoffBase(Duration.ofSeconds(10))
            .maxBackoff(Duration.ofMinutes(1))
            .jitterFactor(0.2)
            .build();

        for (int i = 0; i < 50; i++) {
            long ms = policy.computeBackoff(1).toMillis();
            assertTrue(ms >= 8000 && ms <= 12000, "backoff out of range: " + ms);
        }
    }

    @Test
    void computeBackoff_shouldRejectAttemptZero() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaultPolicy().computeBackoff(0));
    }

    @Test
    void hasMoreAttempts_shouldStopAtMaxAttempts() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        assertTrue(policy.hasMoreAttempts(1));
        assertTrue(policy.hasMoreAttempts(2));
        assertFalse(policy.hasMoreAttempts(3));
    }

    @Test
    void shouldRetry_shouldHonorNonRetryableErrors() {
        RetryPolicy policy = RetryPolicy.builder()
            .nonRetryableErrors(Set.of("PERMISSION_DENIED"))
            .build();

        assertTrue(policy.shouldRetry("NETWORK"));
        assertTrue(policy.shouldRetry(null));
        assertFalse(policy.shouldRetry("PERMISSION_DENIED"));
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().backoffMultiplier(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .backoffBase(Duration.ofMinutes(5)).maxBackoff(Duration.ofMinutes(1)).build());
    }
}
