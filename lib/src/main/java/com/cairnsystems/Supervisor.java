package com.cairnsystems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an actor's {@link SupervisionStrategy} when its handler throws.
 */
public final class Supervisor {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private Supervisor() {
    }

    /**
     * Handles an exception thrown during message processing of an actor.
     * Runs on the failing actor's mailbox thread.
     *
     * @param actor     The actor that experienced the error
     * @param message   The message being processed when the error occurred
     * @param exception The exception that was thrown
     * @param <T>       The actor's message type
     */
    public static <T> void handleException(Actor<T> actor, T message, Throwable exception) {
        boolean shouldReprocess = actor.onError(message, exception);
        switch (actor.getSupervisionStrategy()) {
            case RESUME -> logger.debug("Actor {} resuming after error", actor.getActorId());
            case RESTART -> {
                logger.info("Restarting actor {}", actor.getActorId());
                actor.restart(message, shouldReprocess);
            }
            case STOP -> {
                logger.info("Stopping actor {} due to error", actor.getActorId());
                actor.stop();
            }
        }
    }
}
