package com.cairnsystems;

import com.cairnsystems.config.ThreadPoolFactory;
import com.cairnsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Encapsulates mailbox polling and message dispatch for an actor.
 * Handles batching, interruption, and exception routing. Exactly one thread drains a mailbox.
 *
 * @param <T> The type of messages in the mailbox
 */
public class MailboxProcessor<T> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private static final long POLL_TIMEOUT_MS = 10;
    private static final long START_TIMEOUT_SECONDS = 5;

    private final String actorId;
    private final Mailbox<T> mailbox;
    private final int batchSize;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final ActorLifecycle<T> lifecycle;
    private final ThreadPoolFactory threadPoolFactory;

    private volatile boolean running = false;
    private volatile Thread thread;

    /**
     * Creates a new mailbox processor.
     *
     * @param actorId           The ID of the actor for logging
     * @param mailbox           The mailbox to poll messages from
     * @param batchSize         Number of messages to process per batch
     * @param exceptionHandler  Handler to route message processing errors
     * @param lifecycle         Lifecycle hooks (preStart/postStop)
     * @param threadPoolFactory The factory that creates the mailbox thread
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<T> mailbox,
            int batchSize,
            BiConsumer<T, Throwable> exceptionHandler,
            ActorLifecycle<T> lifecycle,
            ThreadPoolFactory threadPoolFactory) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.batchSize = Math.max(1, batchSize);
        this.exceptionHandler = exceptionHandler;
        this.lifecycle = lifecycle;
        this.threadPoolFactory = threadPoolFactory;
    }

    /**
     * Starts mailbox polling on a dedicated thread.
     * Blocks until the thread is running so that messages sent right after start are not raced.
     */
    public void start() {
        if (running) {
            logger.debug("Actor {} mailbox already running", actorId);
            return;
        }
        running = true;
        logger.debug("Starting actor {} mailbox", actorId);
        lifecycle.preStart();

        CountDownLatch readyLatch = new CountDownLatch(1);
        thread = threadPoolFactory.createThreadFactory("actor-" + actorId).newThread(() -> {
            readyLatch.countDown();
            processMailboxLoop();
        });
        thread.start();

        try {
            if (!readyLatch.await(START_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Actor {} did not start within timeout", actorId);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for actor {} to start", actorId);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops mailbox polling and drops remaining messages.
     */
    public void stop() {
        stop(true);
    }

    /**
     * Stops mailbox polling with optional mailbox clearing.
     *
     * @param clearMailbox If true, clears pending messages; if false, preserves them
     */
    public void stop(boolean clearMailbox) {
        if (!running) {
            return;
        }
        running = false;
        logger.debug("Stopping actor {} mailbox (clearMailbox={})", actorId, clearMailbox);
        if (clearMailbox) {
            mailbox.clear();
        }
        // The mailbox thread may be stopping itself
        Thread current = thread;
        if (current != null && Thread.currentThread() != current) {
            current.interrupt();
            try {
                current.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        thread = null;
        lifecycle.postStop();
    }

    /**
     * Delivers a message to the mailbox.
     *
     * @param message The message to enqueue
     */
    public void tell(T message) {
        if (!mailbox.offer(message)) {
            logger.warn("Actor {} mailbox full, dropping message {}", actorId, message);
        }
    }

    public boolean isRunning() {
        return running;
    }

    // A restart replaces the thread; a superseded loop must stop draining.
    private boolean ownsMailbox() {
        return running && thread == Thread.currentThread();
    }

    private void processMailboxLoop() {
        List<T> batchBuffer = new ArrayList<>(batchSize);
        while (ownsMailbox()) {
            try {
                batchBuffer.clear();
                T first = mailbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batchBuffer.add(first);
                if (batchSize > 1) {
                    mailbox.drainTo(batchBuffer, batchSize - 1);
                }
                for (T msg : batchBuffer) {
                    if (!ownsMailbox()) {
                        break;
                    }
                    try {
                        lifecycle.receive(msg);
                    } catch (Throwable e) {
                        logger.error("Actor {} error processing message: {}", actorId, msg, e);
                        exceptionHandler.accept(msg, e);
                    }
                }
            } catch (InterruptedException e) {
                logger.debug("Actor {} mailbox interrupted", actorId);
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
