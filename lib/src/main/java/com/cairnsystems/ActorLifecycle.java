package com.cairnsystems;

/**
 * Lifecycle callbacks the {@link MailboxProcessor} drives for its actor.
 *
 * @param <T> The type of messages accepted by the actor
 */
public interface ActorLifecycle<T> {
    /** Called on the starting thread before the mailbox loop begins. */
    void preStart();

    /**
     * Called on the mailbox thread for every dequeued message.
     *
     * @param message the message to be processed by the actor
     */
    void receive(T message);

    /** Called after mailbox processing ends. */
    void postStop();
}
