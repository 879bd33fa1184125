package com.cairnsystems.persistence.journal;

import com.cairnsystems.Pid;
import com.cairnsystems.pattern.CircuitBreaker;
import com.cairnsystems.pattern.CircuitBreakerOpenException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConcurrencyGate.
 */
class ConcurrencyGateTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Chunk chunk(long id) {
        return Chunk.of(id, List.of(new JournalRequest.ReadHighestSequenceNr(0, "p", new Pid("reply-to", null))));
    }

    private static CircuitBreaker breaker(int maxFailures) {
        return new CircuitBreaker("test", maxFailures, Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    private static ChunkOutcome emptyOutcome(Chunk chunk) {
        return ChunkOutcome.builder(chunk.chunkId()).build(Duration.ZERO);
    }

    @Test
    void testTokensAreTakenAndReturned() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(2, breaker(5), executor, ConcurrencyGateTest::emptyOutcome);

        CompletableFuture<ChunkOutcome> first = gate.admit(chunk(1));
        gate.admit(chunk(2));

        assertFalse(gate.hasCapacity());
        assertEquals(2, gate.getInFlight());
        assertEquals(1, first.get(5, TimeUnit.SECONDS).chunkId());

        gate.release();
        assertTrue(gate.hasCapacity());
        assertEquals(1, gate.getRemainingTokens());
    }

    @Test
    void testAdmitWithoutCapacityThrows() {
        ConcurrencyGate gate = new ConcurrencyGate(1, breaker(5), executor, ConcurrencyGateTest::emptyOutcome);
        gate.admit(chunk(1));

        assertThrows(IllegalStateException.class, () -> gate.admit(chunk(2)));
    }

    @Test
    void testReleaseBeyondMaximumThrows() {
        ConcurrencyGate gate = new ConcurrencyGate(1, breaker(5), executor, ConcurrencyGateTest::emptyOutcome);

        assertThrows(IllegalStateException.class, gate::release);
    }

    @Test
    void testOpenBreakerSkipsExecution() {
        AtomicInteger executions = new AtomicInteger();
        ConcurrencyGate gate = new ConcurrencyGate(4, breaker(1), executor, chunk -> {
            executions.incrementAndGet();
            throw new IllegalStateException("storage down");
        });

        ExecutionException first = assertThrows(ExecutionException.class,
                () -> gate.admit(chunk(1)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, first.getCause());
        gate.release();

        ExecutionException second = assertThrows(ExecutionException.class,
                () -> gate.admit(chunk(2)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(CircuitBreakerOpenException.class, second.getCause());
        assertEquals(1, executions.get());
        assertEquals(CircuitBreaker.State.OPEN, gate.getCircuitBreaker().getState());
    }
}
