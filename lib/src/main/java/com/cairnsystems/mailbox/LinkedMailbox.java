package com.cairnsystems.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default mailbox implementation using LinkedBlockingQueue.
 * Recommended when a bounded capacity is needed.
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue;

    /**
     * Creates an unbounded mailbox.
     */
    public LinkedMailbox() {
        this.queue = new LinkedBlockingQueue<>();
    }

    /**
     * Creates a bounded mailbox with the specified capacity.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMailbox(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        return queue.drainTo(collection, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    @Override
    public void clear() {
        queue.clear();
    }
}
