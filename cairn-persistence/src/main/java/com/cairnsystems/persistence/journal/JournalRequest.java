package com.cairnsystems.persistence.journal;

import com.cairnsystems.Pid;
import com.cairnsystems.ReplyingMessage;

import java.util.List;
import java.util.Objects;

/**
 * Operations accepted by the journal. Every request names the actor that receives its responses.
 * The set of request kinds is closed; handlers dispatch through {@link Visitor}.
 */
public sealed interface JournalRequest extends ReplyingMessage
        permits JournalRequest.WriteMessages,
                JournalRequest.ReplayMessages,
                JournalRequest.ReadHighestSequenceNr,
                JournalRequest.DeleteMessagesTo,
                JournalRequest.ReplayTaggedMessages {

    /**
     * @return true when executing the request never modifies storage
     */
    boolean isReadOnly();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over the request kinds.
     *
     * @param <R> result of handling one request
     */
    interface Visitor<R> {
        R visitWrite(WriteMessages request);

        R visitReplay(ReplayMessages request);

        R visitReadHighest(ReadHighestSequenceNr request);

        R visitDelete(DeleteMessagesTo request);

        R visitReplayTagged(ReplayTaggedMessages request);
    }

    /**
     * Appends records. Answered with one summary followed by one response per record.
     *
     * @param messages        groups of records to write, in order
     * @param replyTo         receiver of the responses
     * @param actorInstanceId echoed in per-record responses
     */
    record WriteMessages(List<AtomicWrite> messages, Pid replyTo, int actorInstanceId) implements JournalRequest {
        public WriteMessages {
            messages = List.copyOf(messages);
        }

        @Override
        public boolean isReadOnly() {
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWrite(this);
        }
    }

    /**
     * Replays the records of one stream in sequence order, followed by {@link JournalResponse.RecoverySuccess}.
     *
     * @param fromSequenceNr first sequence number, inclusive
     * @param toSequenceNr   last sequence number, inclusive; clamped to the highest stored
     * @param max            maximum number of records to deliver
     * @param persistenceId  stream to replay
     * @param replyTo        receiver of the responses
     */
    record ReplayMessages(long fromSequenceNr, long toSequenceNr, long max, String persistenceId, Pid replyTo)
            implements JournalRequest {
        public ReplayMessages {
            Objects.requireNonNull(persistenceId, "persistenceId");
        }

        @Override
        public boolean isReadOnly() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReplay(this);
        }
    }

    /**
     * Reads the highest sequence number ever written to a stream, deleted records included.
     *
     * @param fromSequenceNr hint carried for callers; the journal always reads the full stream
     * @param persistenceId  stream to inspect
     * @param replyTo        receiver of the response
     */
    record ReadHighestSequenceNr(long fromSequenceNr, String persistenceId, Pid replyTo) implements JournalRequest {
        public ReadHighestSequenceNr {
            Objects.requireNonNull(persistenceId, "persistenceId");
        }

        @Override
        public boolean isReadOnly() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReadHighest(this);
        }
    }

    /**
     * Physically deletes every record of a stream up to and including {@code toSequenceNr}.
     *
     * @param persistenceId stream to truncate
     * @param toSequenceNr  last sequence number to delete
     * @param replyTo       receiver of the response
     */
    record DeleteMessagesTo(String persistenceId, long toSequenceNr, Pid replyTo) implements JournalRequest {
        public DeleteMessagesTo {
            Objects.requireNonNull(persistenceId, "persistenceId");
        }

        @Override
        public boolean isReadOnly() {
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    /**
     * Replays records carrying {@code tag} in global ordering, from {@code fromOffset} (exclusive)
     * up to {@code toOffset}.
     *
     * @param fromOffset ordering cursor, exclusive
     * @param toOffset   upper ordering bound
     * @param max        maximum number of rows to read
     * @param tag        tag to match
     * @param replyTo    receiver of the responses
     */
    record ReplayTaggedMessages(long fromOffset, long toOffset, long max, String tag, Pid replyTo)
            implements JournalRequest {
        public ReplayTaggedMessages {
            Objects.requireNonNull(tag, "tag");
        }

        @Override
        public boolean isReadOnly() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReplayTagged(this);
        }
    }
}
