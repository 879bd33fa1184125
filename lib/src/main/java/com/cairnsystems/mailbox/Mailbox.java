package com.cairnsystems.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Abstraction for actor mailbox operations.
 * Many threads offer, exactly one thread (the actor's mailbox processor) polls.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message if it is possible to do so immediately without exceeding capacity.
     *
     * @param message the message to add
     * @return true if the message was added, false if the mailbox is full
     */
    boolean offer(T message);

    /**
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time if necessary for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes up to maxElements available messages and adds them to the given collection.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    int size();

    boolean isEmpty();

    /**
     * @return the remaining capacity, or Integer.MAX_VALUE if unbounded
     */
    int remainingCapacity();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();
}
