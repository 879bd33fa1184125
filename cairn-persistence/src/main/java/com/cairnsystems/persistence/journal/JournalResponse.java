package com.cairnsystems.persistence.journal;

/**
 * Messages the journal sends back to the {@code replyTo} of a {@link JournalRequest}.
 */
public sealed interface JournalResponse
        permits JournalResponse.WriteMessagesSuccessful,
                JournalResponse.WriteMessagesFailed,
                JournalResponse.WriteMessageSuccess,
                JournalResponse.WriteMessageRejected,
                JournalResponse.WriteMessageFailure,
                JournalResponse.ReplayedMessage,
                JournalResponse.RecoverySuccess,
                JournalResponse.ReplayMessagesFailure,
                JournalResponse.ReadHighestSequenceNrSuccess,
                JournalResponse.ReadHighestSequenceNrFailure,
                JournalResponse.DeleteMessagesSuccess,
                JournalResponse.DeleteMessagesFailure,
                JournalResponse.ReplayedTaggedMessage {

    /**
     * Summary of a write request in which every record reached storage.
     */
    record WriteMessagesSuccessful() implements JournalResponse {
    }

    /**
     * Summary of a write request in which at least one insert failed, or which was refused as a whole.
     */
    record WriteMessagesFailed(Throwable cause) implements JournalResponse {
    }

    record WriteMessageSuccess(PersistentRecord persistent, int actorInstanceId) implements JournalResponse {
    }

    /**
     * The record was refused before reaching storage (serialization, invalid tag, adapter failure).
     */
    record WriteMessageRejected(PersistentRecord persistent, Throwable cause, int actorInstanceId)
            implements JournalResponse {
    }

    /**
     * The store refused the insert of this record.
     */
    record WriteMessageFailure(PersistentRecord persistent, Throwable cause, int actorInstanceId)
            implements JournalResponse {
    }

    record ReplayedMessage(PersistentRecord persistent) implements JournalResponse {
    }

    /**
     * Terminates a replay.
     *
     * @param highestSequenceNr highest sequence number of the stream for a replay by id,
     *                          highest sequence number delivered for a replay by tag
     */
    record RecoverySuccess(long highestSequenceNr) implements JournalResponse {
    }

    record ReplayMessagesFailure(Throwable cause) implements JournalResponse {
    }

    record ReadHighestSequenceNrSuccess(long highestSequenceNr) implements JournalResponse {
    }

    record ReadHighestSequenceNrFailure(Throwable cause) implements JournalResponse {
    }

    record DeleteMessagesSuccess(long toSequenceNr) implements JournalResponse {
    }

    record DeleteMessagesFailure(Throwable cause, long toSequenceNr) implements JournalResponse {
    }

    /**
     * @param persistent the record
     * @param tag        the tag that matched
     * @param offset     global ordering of the row; usable as the next {@code fromOffset}
     */
    record ReplayedTaggedMessage(PersistentRecord persistent, String tag, long offset) implements JournalResponse {
    }
}
