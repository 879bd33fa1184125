package com.cairnsystems.persistence.journal;

import com.cairnsystems.pattern.CircuitBreaker;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Bounds the number of chunks executing at once. Each admitted chunk holds one token until the
 * journal observes its completion and calls {@link #release()}.
 * <p>
 * The token counter is only touched from the journal's actor thread; execution runs on the storage
 * executor under the circuit breaker.
 */
public class ConcurrencyGate {

    private final int maxTokens;
    private final CircuitBreaker circuitBreaker;
    private final Executor storageExecutor;
    private final Function<Chunk, ChunkOutcome> execution;
    private int remainingTokens;

    public ConcurrencyGate(int maxTokens,
                           CircuitBreaker circuitBreaker,
                           Executor storageExecutor,
                           Function<Chunk, ChunkOutcome> execution) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("Max concurrent operations must be positive");
        }
        this.maxTokens = maxTokens;
        this.remainingTokens = maxTokens;
        this.circuitBreaker = circuitBreaker;
        this.storageExecutor = storageExecutor;
        this.execution = execution;
    }

    public boolean hasCapacity() {
        return remainingTokens > 0;
    }

    /**
     * Takes a token and starts executing {@code chunk}. While the circuit breaker is open the
     * returned future fails immediately without touching storage.
     *
     * @throws IllegalStateException if no token is available
     */
    public CompletableFuture<ChunkOutcome> admit(Chunk chunk) {
        if (remainingTokens <= 0) {
            throw new IllegalStateException("No execution slot available for chunk " + chunk.chunkId());
        }
        remainingTokens--;
        return circuitBreaker.withCircuitBreaker(
                () -> CompletableFuture.supplyAsync(() -> execution.apply(chunk), storageExecutor));
    }

    /**
     * Returns the token of a completed chunk.
     */
    public void release() {
        if (remainingTokens >= maxTokens) {
            throw new IllegalStateException("Released more tokens than were taken");
        }
        remainingTokens++;
    }

    public int getRemainingTokens() {
        return remainingTokens;
    }

    public int getInFlight() {
        return maxTokens - remainingTokens;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
