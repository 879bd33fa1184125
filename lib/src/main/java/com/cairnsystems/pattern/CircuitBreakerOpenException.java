package com.cairnsystems.pattern;

import java.time.Duration;

/**
 * Completes a call that was rejected because the {@link CircuitBreaker} is open.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final Duration remainingDuration;

    public CircuitBreakerOpenException(Duration remainingDuration) {
        super("Circuit breaker is open; calls fail fast for another " + remainingDuration.toMillis() + " ms");
        this.remainingDuration = remainingDuration;
    }

    /**
     * @return time left until the breaker lets a trial call through
     */
    public Duration getRemainingDuration() {
        return remainingDuration;
    }
}
