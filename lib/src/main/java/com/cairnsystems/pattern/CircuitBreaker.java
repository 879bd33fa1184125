package com.cairnsystems.pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Closed / open / half-open failure isolation for asynchronous calls.
 * <p>
 * While closed, calls pass through and consecutive failures are counted; a call that has not
 * completed within {@code callTimeout} counts as a failure. After {@code maxFailures} consecutive
 * failures the breaker opens and every call fails immediately with
 * {@link CircuitBreakerOpenException} without invoking the body. Once {@code resetTimeout} has
 * elapsed the breaker half-opens and lets exactly one trial call through: success closes it,
 * failure opens it again.
 * <p>
 * Outcomes of calls admitted before the most recent transition are ignored, so a straggler
 * that fails after the breaker opened does not push the half-open time back, and one that
 * succeeds while a trial is in flight does not close the breaker.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * Breaker states.
     */
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int maxFailures;
    private final Duration callTimeout;
    private final Duration resetTimeout;

    // Every transition installs a new Phase; calls remember the one that admitted them
    private final AtomicReference<Phase> phase = new AtomicReference<>(new Phase(State.CLOSED, 0, 0L));
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final List<BiConsumer<State, State>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param name         used in log lines
     * @param maxFailures  consecutive failures that open the breaker
     * @param callTimeout  time after which a pending call counts as failed
     * @param resetTimeout time the breaker stays open before a trial call
     */
    public CircuitBreaker(String name, int maxFailures, Duration callTimeout, Duration resetTimeout) {
        if (maxFailures <= 0) {
            throw new IllegalArgumentException("maxFailures must be positive, got " + maxFailures);
        }
        this.name = name;
        this.maxFailures = maxFailures;
        this.callTimeout = callTimeout;
        this.resetTimeout = resetTimeout;
    }

    /**
     * Runs {@code body} under the breaker.
     *
     * @param body produces the asynchronous call; not invoked while the breaker is open
     * @param <T>  result type
     * @return a future completing with the body's result, or exceptionally with the body's failure,
     * a {@link TimeoutException} after {@code callTimeout}, or a {@link CircuitBreakerOpenException}
     */
    public <T> CompletableFuture<T> withCircuitBreaker(Supplier<CompletableFuture<T>> body) {
        Phase admittedIn = admitCall();
        if (admittedIn == null) {
            return CompletableFuture.failedFuture(new CircuitBreakerOpenException(remainingOpenDuration()));
        }

        CompletableFuture<T> call;
        try {
            call = body.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        call.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        result.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((value, error) -> {
            if (error != null) {
                onFailure(admittedIn, error);
            } else {
                onSuccess(admittedIn);
            }
        });
        return result;
    }

    public State getState() {
        return phase.get().state();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * Registers a callback invoked with (from, to) on every state transition.
     *
     * @param listener the callback
     */
    public void addStateListener(BiConsumer<State, State> listener) {
        listeners.add(listener);
    }

    /**
     * @return the phase the call was admitted in, or null if it must fail fast
     */
    private Phase admitCall() {
        while (true) {
            Phase current = phase.get();
            switch (current.state()) {
                case CLOSED:
                    return current;
                case OPEN:
                    if (System.nanoTime() - current.openedAtNanos() < resetTimeout.toNanos()) {
                        return null;
                    }
                    // The caller that wins the move to half-open carries the trial
                    Phase halfOpen = transition(current, State.HALF_OPEN);
                    if (halfOpen != null) {
                        return halfOpen;
                    }
                    break;
                case HALF_OPEN:
                    return null;
                default:
                    throw new IllegalStateException("Unknown state " + current.state());
            }
        }
    }

    private void onSuccess(Phase admittedIn) {
        Phase current = phase.get();
        if (current.generation() != admittedIn.generation()) {
            logger.debug("Circuit breaker {} ignoring success of a call admitted while {}", name, admittedIn.state());
            return;
        }
        consecutiveFailures.set(0);
        if (current.state() == State.HALF_OPEN) {
            transition(current, State.CLOSED);
        }
    }

    private void onFailure(Phase admittedIn, Throwable error) {
        Phase current = phase.get();
        if (current.generation() != admittedIn.generation()) {
            logger.debug("Circuit breaker {} ignoring failure of a call admitted while {}", name, admittedIn.state(), error);
            return;
        }
        int failures = consecutiveFailures.incrementAndGet();
        logger.debug("Circuit breaker {} recorded failure {} of {}", name, failures, maxFailures, error);
        if (current.state() == State.HALF_OPEN || failures >= maxFailures) {
            transition(current, State.OPEN);
        }
    }

    /**
     * @return the installed phase, or null if another thread moved the breaker first
     */
    private Phase transition(Phase from, State to) {
        long openedAt = to == State.OPEN ? System.nanoTime() : from.openedAtNanos();
        Phase next = new Phase(to, from.generation() + 1, openedAt);
        if (!phase.compareAndSet(from, next)) {
            return null;
        }
        if (to == State.OPEN) {
            logger.warn("Circuit breaker {} opened after {} consecutive failures; failing fast for {} ms",
                    name, consecutiveFailures.get(), resetTimeout.toMillis());
        } else {
            logger.info("Circuit breaker {} moved from {} to {}", name, from.state(), to);
        }
        if (to == State.CLOSED) {
            consecutiveFailures.set(0);
        }
        for (BiConsumer<State, State> listener : listeners) {
            listener.accept(from.state(), to);
        }
        return next;
    }

    private Duration remainingOpenDuration() {
        long remaining = resetTimeout.toNanos() - (System.nanoTime() - phase.get().openedAtNanos());
        return Duration.ofNanos(Math.max(0, remaining));
    }

    private record Phase(State state, long generation, long openedAtNanos) {}
}
