package com.cairnsystems.persistence.journal;

import java.io.Serializable;
import java.util.Objects;

/**
 * One event of a persistent stream, as written by its owner and as delivered on replay.
 *
 * @param persistenceId stream the event belongs to
 * @param sequenceNr    position of the event in its stream, starting at 1
 * @param payload       the event itself, or a {@link Tagged} envelope on the write path
 * @param manifest      type hint of the payload; empty when the serializer decides
 * @param deleted       legacy soft-delete marker; deleted records are never replayed
 * @param writerUuid    identity of the writing incarnation
 * @param timestamp     write time in epoch millis; 0 means "stamp on insert"
 */
public record PersistentRecord(String persistenceId,
                               long sequenceNr,
                               Object payload,
                               String manifest,
                               boolean deleted,
                               String writerUuid,
                               long timestamp) implements Serializable {

    public PersistentRecord {
        Objects.requireNonNull(persistenceId, "persistenceId");
        if (manifest == null) {
            manifest = "";
        }
    }

    public PersistentRecord(String persistenceId, long sequenceNr, Object payload) {
        this(persistenceId, sequenceNr, payload, "", false, "", 0L);
    }

    public PersistentRecord withPayload(Object newPayload) {
        return new PersistentRecord(persistenceId, sequenceNr, newPayload, manifest, deleted, writerUuid, timestamp);
    }

    public PersistentRecord withManifest(String newManifest) {
        return new PersistentRecord(persistenceId, sequenceNr, payload, newManifest, deleted, writerUuid, timestamp);
    }

    public PersistentRecord withTimestamp(long newTimestamp) {
        return new PersistentRecord(persistenceId, sequenceNr, payload, manifest, deleted, writerUuid, newTimestamp);
    }
}
