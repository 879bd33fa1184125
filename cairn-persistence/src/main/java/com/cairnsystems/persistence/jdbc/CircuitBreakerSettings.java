package com.cairnsystems.persistence.jdbc;

import java.time.Duration;

/**
 * Parameters of the circuit breaker guarding chunk execution.
 */
public class CircuitBreakerSettings {

    private int maxFailures = 5;
    private Duration callTimeout = Duration.ofSeconds(20);
    private Duration resetTimeout = Duration.ofSeconds(60);

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final CircuitBreakerSettings settings = new CircuitBreakerSettings();

        public Builder maxFailures(int maxFailures) {
            settings.maxFailures = maxFailures;
            return this;
        }

        public Builder callTimeout(Duration timeout) {
            settings.callTimeout = timeout;
            return this;
        }

        public Builder resetTimeout(Duration timeout) {
            settings.resetTimeout = timeout;
            return this;
        }

        public CircuitBreakerSettings build() {
            settings.validate();
            return settings;
        }
    }

    private void validate() {
        if (maxFailures <= 0) {
            throw new IllegalArgumentException("Max failures must be positive");
        }
        if (callTimeout == null || resetTimeout == null) {
            throw new IllegalArgumentException("Circuit breaker timeouts cannot be null");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("Call timeout must be positive");
        }
        if (resetTimeout.isNegative()) {
            throw new IllegalArgumentException("Reset timeout cannot be negative");
        }
    }

    public int getMaxFailures() { return maxFailures; }
    public Duration getCallTimeout() { return callTimeout; }
    public Duration getResetTimeout() { return resetTimeout; }

    @Override
    public String toString() {
        return "CircuitBreakerSettings{" +
                "maxFailures=" + maxFailures +
                ", callTimeout=" + callTimeout +
                ", resetTimeout=" + resetTimeout +
                '}';
    }
}
