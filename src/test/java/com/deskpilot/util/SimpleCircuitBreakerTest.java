package com.deskpilot.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SimpleCircuitBreakerTest {

    @Test
    void shouldOpenAfterConsecutiveFailures() {
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("test", 2, Duration.ofMinutes(1), 1);

        breaker.recordFailure(new RuntimeException("one"));
        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());

        breaker.recordFailure(new RuntimeException("two"));
        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }

    @Test
    void shouldResetFailureCountOnSuccess() {
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("test", 2, Duration.ofMinutes(1), 1);

        breaker.recordFailure(new RuntimeException("one"));
        breaker.recordSuccess();
        breaker.recordFailure(new RuntimeException("two"));

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void shouldAllowTrialCallWhenOpenDurationElapsed() {
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("test", 1, Duration.ZERO, 1);
        breaker.recordFailure(new RuntimeException("down"));

        assertTrue(breaker.allowRequest());
        assertEquals(SimpleCircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest(), "only one trial call is allowed while half-open");

        breaker.recordSuccess();
        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void shouldReopenWhenTrialCallFails() {
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker("test", 1, Duration.ZERO, 1);
        breaker.recordFailure(new RuntimeException("down"));
        assertTrue(breaker.allowRequest());

        breaker.recordFailure(new RuntimeException("still down"));

        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
    }
}
