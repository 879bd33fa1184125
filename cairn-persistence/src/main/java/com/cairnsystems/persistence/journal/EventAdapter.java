package com.cairnsystems.persistence.journal;

import java.util.List;

/**
 * Hook between the domain model and the stored model. Applied to every record written and to
 * every row read back by a replay.
 */
public interface EventAdapter {

    EventAdapter IDENTITY = new EventAdapter() {
    };

    /**
     * @param record record as submitted
     * @return the record to store
     */
    default PersistentRecord toJournal(PersistentRecord record) {
        return record;
    }

    /**
     * @param record record as read from storage
     * @return the records to deliver; may be empty
     */
    default List<PersistentRecord> fromJournal(PersistentRecord record) {
        return List.of(record);
    }
}
