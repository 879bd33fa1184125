package com.cairnsystems.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 * <p>
 * Enqueuing is lock-free. A consumer that finds the queue empty parks on a condition, and
 * producers only take the lock when a consumer is parked. Unbounded: {@link #offer} never
 * rejects a message.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean consumerWaiting = false;

    /**
     * Creates an MPSC mailbox with default chunk size (128).
     */
    public MpscMailbox() {
        this(128);
    }

    /**
     * Creates an MPSC mailbox with the specified chunk size, rounded up to a power of two.
     *
     * @param chunkSize the size of each array chunk
     */
    public MpscMailbox(int chunkSize) {
        // JCTools requires at least 2
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(Math.max(2, chunkSize)));
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        boolean added = queue.offer(message);
        if (added && consumerWaiting) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
        return added;
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            consumerWaiting = true;
            while (true) {
                // Re-check after publishing the waiting flag so a concurrent offer is not missed
                message = queue.poll();
                if (message != null || nanos <= 0) {
                    return message;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        while (count < maxElements) {
            T message = queue.poll();
            if (message == null) {
                break;
            }
            collection.add(message);
            count++;
        }
        return count;
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
        return Integer.MAX_VALUE;
    }

    @Override
    public void clear() {
        queue.clear();
    }

    private static int nextPowerOfTwo(int value) {
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
