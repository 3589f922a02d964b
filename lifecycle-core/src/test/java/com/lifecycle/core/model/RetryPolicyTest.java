package com.lifecycle.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldHaveReasonableDefaults() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        
        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(10), policy.initialBackoff());
        assertEquals(Duration.ofSeconds(1), policy.maxBackoff());
        assertEquals(2.0, policy.backoffMultiplier());
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, 0.0);
        
        assertEquals(Duration.ofMillis(100), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(200), policy.computeBackoff(2));
        assertEquals(Duration.ofMillis(400), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.0);
        
        // Attempt 5: 2^4 = 16s, but capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_shouldStayWithinJitterRange() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(10), 2.0, 0.1);
        
        for (int i = 0; i < 50; i++) {
            long millis = policy.computeBackoff(1).toMillis();
            assertTrue(millis >= 900 && millis <= 1100, "Backoff out of range: " + millis);
        }
    }

    @Test
    void computeBackoff_shouldRejectZeroAttempt() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaultPolicy().computeBackoff(0));
    }

    @Test
    void hasMoreAttempts_shouldStopAtMaxAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        
        assertTrue(policy.hasMoreAttempts(1));
        assertTrue(policy.hasMoreAttempts(4));
        assertFalse(policy.hasMoreAttempts(5));
    }

    @Test
    void noRetry_shouldAllowSingleAttempt() {
        RetryPolicy policy = RetryPolicy.noRetry();
        
        assertEquals(1, policy.maxAttempts());
        assertFalse(policy.hasMoreAttempts(1));
    }

    @Test
    void constructor_shouldRejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 1.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.5, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, 1.5));
    }
}
