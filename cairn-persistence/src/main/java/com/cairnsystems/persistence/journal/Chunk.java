package com.cairnsystems.persistence.journal;

import java.util.List;

/**
 * Requests dequeued together and executed on one connection.
 *
 * @param chunkId  sequential id, for logging
 * @param requests requests in submission order
 * @param readOnly true when no request of the chunk writes
 */
public record Chunk(long chunkId, List<JournalRequest> requests, boolean readOnly) {

    public Chunk {
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("A chunk holds at least one request");
        }
        requests = List.copyOf(requests);
    }

    public static Chunk of(long chunkId, List<JournalRequest> requests) {
        boolean readOnly = true;
        for (JournalRequest request : requests) {
            if (!request.isReadOnly()) {
                readOnly = false;
                break;
            }
        }
        return new Chunk(chunkId, requests, readOnly);
    }

    public int size() {
        return requests.size();
    }
}
