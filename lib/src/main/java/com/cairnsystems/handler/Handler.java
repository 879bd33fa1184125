package com.cairnsystems.handler;

import com.cairnsystems.ActorContext;

/**
 * Interface for handling messages in a stateless actor.
 * This provides a clean separation between the actor implementation and message handling logic.
 *
 * @param <Message> The type of messages this handler processes
 */
public interface Handler<Message> {

    /**
     * Processes a message.
     *
     * @param message The message to process
     * @param context The actor context providing access to actor functionality
     */
    void receive(Message message, ActorContext context);

    /**
     * Called before the actor starts processing messages.
     *
     * @param context The actor context providing access to actor functionality
     */
    default void preStart(ActorContext context) {
        // Default implementation does nothing
    }

    /**
     * Called after the actor has stopped processing messages.
     *
     * @param context The actor context providing access to actor functionality
     */
    default void postStop(ActorContext context) {
        // Default implementation does nothing
    }

    /**
     * Called when an exception occurs during message processing.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     * @param context   The actor context providing access to actor functionality
     * @return true if the error is fully handled and supervision should be skipped
     */
    default boolean onError(Message message, Throwable exception, ActorContext context) {
        return false;
    }
}
