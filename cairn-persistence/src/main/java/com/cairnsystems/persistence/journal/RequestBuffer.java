package com.cairnsystems.persistence.journal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO of requests waiting for a free execution slot. Confined to the journal's actor thread.
 */
public class RequestBuffer {

    private final Deque<JournalRequest> queue = new ArrayDeque<>();
    private final int maxBufferSize;
    private long nextChunkId = 1;

    /**
     * @param maxBufferSize number of requests held before {@link #offer(JournalRequest)} refuses more
     */
    public RequestBuffer(int maxBufferSize) {
        if (maxBufferSize <= 0) {
            throw new IllegalArgumentException("Max buffer size must be positive");
        }
        this.maxBufferSize = maxBufferSize;
    }

    /**
     * @return false, leaving the buffer unchanged, when it already holds {@code maxBufferSize} requests
     */
    public boolean offer(JournalRequest request) {
        if (queue.size() >= maxBufferSize) {
            return false;
        }
        queue.addLast(request);
        return true;
    }

    /**
     * Removes up to {@code maxBatchSize} requests from the head of the buffer.
     *
     * @return the chunk, or null when the buffer is empty
     */
    public Chunk dequeueChunk(int maxBatchSize) {
        if (queue.isEmpty()) {
            return null;
        }
        int count = Math.min(maxBatchSize, queue.size());
        List<JournalRequest> requests = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            requests.add(queue.pollFirst());
        }
        return Chunk.of(nextChunkId++, requests);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public int getMaxBufferSize() {
        return maxBufferSize;
    }

    /**
     * Drops every pending request.
     *
     * @return the number of requests dropped
     */
    public int clear() {
        int dropped = queue.size();
        queue.clear();
        return dropped;
    }
}
