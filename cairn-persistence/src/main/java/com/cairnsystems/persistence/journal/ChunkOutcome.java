package com.cairnsystems.persistence.journal;

import com.cairnsystems.Pid;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of a successfully executed chunk. Holds everything the journal sends once the chunk is
 * known to be committed: the responses, in order, and the streams and tags that changed.
 *
 * @param chunkId               id of the executed chunk
 * @param deliveries            responses in the order they were produced
 * @param writtenPersistenceIds streams that received at least one record
 * @param writtenTags           tags of the records written
 * @param elapsed               time spent executing the chunk
 */
public record ChunkOutcome(long chunkId,
                           List<Delivery> deliveries,
                           Set<String> writtenPersistenceIds,
                           Set<String> writtenTags,
                           Duration elapsed) {

    public ChunkOutcome {
        deliveries = List.copyOf(deliveries);
        writtenPersistenceIds = Set.copyOf(writtenPersistenceIds);
        writtenTags = Set.copyOf(writtenTags);
    }

    /**
     * A response addressed to one recipient.
     */
    public record Delivery(Pid recipient, JournalResponse message) {
    }

    public static Builder builder(long chunkId) {
        return new Builder(chunkId);
    }

    /**
     * Collects the results of one chunk. Used by a single thread.
     */
    public static class Builder {
        private final long chunkId;
        private final List<Delivery> deliveries = new ArrayList<>();
        private final Set<String> writtenPersistenceIds = new LinkedHashSet<>();
        private final Set<String> writtenTags = new LinkedHashSet<>();

        private Builder(long chunkId) {
            this.chunkId = chunkId;
        }

        public Builder deliver(Pid recipient, JournalResponse message) {
            if (recipient != null) {
                deliveries.add(new Delivery(recipient, message));
            }
            return this;
        }

        public Builder deliverAll(Pid recipient, Collection<? extends JournalResponse> messages) {
            for (JournalResponse message : messages) {
                deliver(recipient, message);
            }
            return this;
        }

        public Builder written(Collection<String> persistenceIds, Collection<String> tags) {
            writtenPersistenceIds.addAll(persistenceIds);
            writtenTags.addAll(tags);
            return this;
        }

        public ChunkOutcome build(Duration elapsed) {
            return new ChunkOutcome(chunkId, deliveries, writtenPersistenceIds, writtenTags, elapsed);
        }
    }
}
