package com.cairnsystems.persistence.journal;

import java.io.Serializable;
import java.util.List;

/**
 * A group of records of one persistence id submitted together.
 *
 * @param payload the records, in sequence order
 */
public record AtomicWrite(List<PersistentRecord> payload) implements Serializable {

    public AtomicWrite {
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("AtomicWrite requires at least one record");
        }
        payload = List.copyOf(payload);
        String persistenceId = payload.get(0).persistenceId();
        for (PersistentRecord record : payload) {
            if (!record.persistenceId().equals(persistenceId)) {
                throw new IllegalArgumentException("AtomicWrite mixes persistence ids "
                        + persistenceId + " and " + record.persistenceId());
            }
        }
    }

    public AtomicWrite(PersistentRecord record) {
        this(List.of(record));
    }

    public String persistenceId() {
        return payload.get(0).persistenceId();
    }

    public long lowestSequenceNr() {
        return payload.get(0).sequenceNr();
    }

    public long highestSequenceNr() {
        return payload.get(payload.size() - 1).sequenceNr();
    }
}
