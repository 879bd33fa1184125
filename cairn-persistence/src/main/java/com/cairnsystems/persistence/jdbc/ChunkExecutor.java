package com.cairnsystems.persistence.jdbc;

import com.cairnsystems.Pid;
import com.cairnsystems.persistence.JournalException;
import com.cairnsystems.persistence.journal.AtomicWrite;
import com.cairnsystems.persistence.journal.Chunk;
import com.cairnsystems.persistence.journal.ChunkOutcome;
import com.cairnsystems.persistence.journal.EventAdapter;
import com.cairnsystems.persistence.journal.JournalRequest;
import com.cairnsystems.persistence.journal.JournalRequest.DeleteMessagesTo;
import com.cairnsystems.persistence.journal.JournalRequest.ReadHighestSequenceNr;
import com.cairnsystems.persistence.journal.JournalRequest.ReplayMessages;
import com.cairnsystems.persistence.journal.JournalRequest.ReplayTaggedMessages;
import com.cairnsystems.persistence.journal.JournalRequest.WriteMessages;
import com.cairnsystems.persistence.journal.JournalResponse;
import com.cairnsystems.persistence.journal.PersistentRecord;
import com.cairnsystems.persistence.journal.Tagged;
import com.cairnsystems.persistence.serialization.PayloadSerializationException;
import com.cairnsystems.persistence.serialization.PayloadSerializer;
import com.cairnsystems.persistence.serialization.SerializedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes a {@link Chunk} against the store on one connection.
 * <p>
 * Write chunks run in one transaction when the journal is transactional; read-only chunks run on a
 * read-only connection without one. Each request is handled by its own handler, which turns
 * failures of single records or single requests into failure responses. Anything that escapes a
 * handler fails the chunk as a whole: the transaction is rolled back and no response is produced
 * for any request of the chunk.
 * <p>
 * Instances are shared by every storage thread; all per-chunk state lives in the handler object
 * created for each execution.
 */
public class ChunkExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ChunkExecutor.class);

    private final StorageDriver driver;
    private final JournalStatements sql;
    private final PayloadSerializer serializer;
    private final EventAdapter eventAdapter;
    private final boolean transactional;
    private final int isolationLevel;
    private final int queryTimeoutSeconds;
    private final AtomicBoolean cancelled;

    public ChunkExecutor(StorageDriver driver, JournalSettings settings, AtomicBoolean cancelled) {
        this.driver = driver;
        this.sql = driver.statements();
        this.serializer = settings.getSerializer();
        this.eventAdapter = settings.getEventAdapter();
        this.transactional = settings.isTransactional();
        this.isolationLevel = settings.getIsolationLevel();
        this.queryTimeoutSeconds = (int) settings.getConnectionTimeout().toSeconds();
        this.cancelled = cancelled;
    }

    /**
     * @return responses and change information of the chunk, to be acted on only after this returns
     * @throws JournalException.StorageException        if the connection or the commit fails
     * @throws JournalException.TransactionFailedException if the rollback after a failure also fails
     * @throws CancellationException                   if the journal is shutting down
     * @throws RuntimeException                        if a handler fails unexpectedly
     */
    public ChunkOutcome execute(Chunk chunk) {
        checkNotCancelled(chunk);
        long started = System.nanoTime();
        boolean inTransaction = transactional && !chunk.readOnly();

        try (Connection connection = driver.openConnection()) {
            if (chunk.readOnly()) {
                connection.setReadOnly(true);
            } else if (inTransaction) {
                connection.setTransactionIsolation(isolationLevel);
                connection.setAutoCommit(false);
            }

            ChunkOutcome.Builder outcome = ChunkOutcome.builder(chunk.chunkId());
            try (StatementCache statements = new StatementCache(connection, queryTimeoutSeconds)) {
                RequestHandlers handlers = new RequestHandlers(statements, outcome);
                for (JournalRequest request : chunk.requests()) {
                    checkNotCancelled(chunk);
                    request.accept(handlers);
                }
                if (inTransaction) {
                    connection.commit();
                }
            } catch (SQLException | RuntimeException e) {
                if (inTransaction) {
                    rollback(connection, chunk, e);
                }
                throw e;
            }
            return outcome.build(Duration.ofNanos(System.nanoTime() - started));
        } catch (SQLException e) {
            throw new JournalException.StorageException("Failed to execute chunk " + chunk.chunkId(), e);
        }
    }

    /**
     * Creates the journal and metadata tables if they do not exist.
     */
    public void createTables() {
        try (Connection connection = driver.openConnection();
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            statement.execute(sql.createJournalTable());
            statement.execute(sql.createMetadataTable());
            logger.info("Initialized journal tables {} and {}",
                    sql.naming().fullJournalTableName(), sql.naming().fullMetadataTableName());
        } catch (SQLException e) {
            throw new JournalException.StorageException("Failed to create journal tables", e);
        }
    }

    /**
     * @return every persistence id with at least one stored record
     */
    public Set<String> loadPersistenceIds() {
        try (Connection connection = driver.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql.selectAllPersistenceIds())) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            Set<String> ids = new HashSet<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new JournalException.StorageException("Failed to load persistence ids", e);
        }
    }

    private void checkNotCancelled(Chunk chunk) {
        if (cancelled.get()) {
            throw new CancellationException("Journal stopped before chunk " + chunk.chunkId() + " completed");
        }
    }

    private void rollback(Connection connection, Chunk chunk, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            JournalException.TransactionFailedException failure = new JournalException.TransactionFailedException(
                    "Failed to roll back chunk " + chunk.chunkId(), e);
            failure.addSuppressed(cause);
            throw failure;
        }
    }

    static String encodeTags(Set<String> tags) {
        if (tags.isEmpty()) {
            return "";
        }
        StringBuilder encoded = new StringBuilder(16).append(Tagged.DELIMITER);
        for (String tag : tags) {
            if (tag.isEmpty() || tag.indexOf(Tagged.DELIMITER) >= 0) {
                throw new IllegalArgumentException("Invalid tag '" + tag + "': tags must be non-empty and must not contain '"
                        + Tagged.DELIMITER + "'");
            }
            encoded.append(tag).append(Tagged.DELIMITER);
        }
        return encoded.toString();
    }

    /**
     * Per-request handlers of one chunk execution.
     */
    private final class RequestHandlers implements JournalRequest.Visitor<Void> {

        private final StatementCache statements;
        private final ChunkOutcome.Builder outcome;

        RequestHandlers(StatementCache statements, ChunkOutcome.Builder outcome) {
            this.statements = statements;
            this.outcome = outcome;
        }

        @Override
        public Void visitWrite(WriteMessages request) {
            List<JournalResponse> responses = new ArrayList<>();
            Set<String> persistenceIds = new LinkedHashSet<>();
            Set<String> tags = new LinkedHashSet<>();
            Throwable insertFailure = null;
            int actorInstanceId = request.actorInstanceId();

            for (AtomicWrite write : request.messages()) {
                for (PersistentRecord unadapted : write.payload()) {
                    PersistentRecord persistent;
                    Set<String> recordTags = Set.of();
                    String encodedTags;
                    SerializedPayload serialized;
                    try {
                        persistent = eventAdapter.toJournal(unadapted);
                        if (persistent.payload() instanceof Tagged tagged) {
                            recordTags = tagged.tags();
                            persistent = persistent.withPayload(tagged.payload());
                        }
                        encodedTags = encodeTags(recordTags);
                        serialized = serializer.serialize(persistent.payload());
                    } catch (RuntimeException e) {
                        // anything thrown before the insert rejects this record only
                        responses.add(new JournalResponse.WriteMessageRejected(unadapted, e, actorInstanceId));
                        continue;
                    }

                    try {
                        PreparedStatement insert = statements.prepare(sql.insertEvent());
                        insert.setString(1, persistent.persistenceId());
                        insert.setLong(2, persistent.sequenceNr());
                        insert.setLong(3, persistent.timestamp() > 0 ? persistent.timestamp() : System.currentTimeMillis());
                        insert.setBoolean(4, false);
                        insert.setString(5, serialized.manifest());
                        insert.setBytes(6, serialized.bytes());
                        insert.setString(7, encodedTags.isEmpty() ? null : encodedTags);
                        insert.executeUpdate();

                        responses.add(new JournalResponse.WriteMessageSuccess(unadapted, actorInstanceId));
                        persistenceIds.add(persistent.persistenceId());
                        tags.addAll(recordTags);
                    } catch (SQLException e) {
                        insertFailure = e;
                        responses.add(new JournalResponse.WriteMessageFailure(unadapted, e, actorInstanceId));
                    }
                }
            }

            JournalResponse summary = insertFailure == null
                    ? new JournalResponse.WriteMessagesSuccessful()
                    : new JournalResponse.WriteMessagesFailed(insertFailure);
            outcome.deliver(request.replyTo(), summary);
            outcome.deliverAll(request.replyTo(), responses);
            outcome.written(persistenceIds, tags);
            return null;
        }

        @Override
        public Void visitReplay(ReplayMessages request) {
            Pid replyTo = request.replyTo();
            try {
                long highestSequenceNr = readHighestSequenceNr(request.persistenceId());
                long toSequenceNr = Math.min(request.toSequenceNr(), highestSequenceNr);
                List<JournalResponse> replayed = new ArrayList<>();

                if (request.max() > 0 && request.fromSequenceNr() <= toSequenceNr) {
                    PreparedStatement select = statements.prepare(sql.selectByPersistenceIdRange());
                    select.setString(1, request.persistenceId());
                    select.setLong(2, request.fromSequenceNr());
                    select.setLong(3, toSequenceNr);
                    try (ResultSet rs = select.executeQuery()) {
                        while (replayed.size() < request.max() && rs.next()) {
                            PersistentRecord stored = readRecord(rs, 1);
                            if (stored.deleted()) {
                                continue;
                            }
                            for (PersistentRecord adapted : eventAdapter.fromJournal(stored)) {
                                if (replayed.size() >= request.max()) {
                                    break;
                                }
                                replayed.add(new JournalResponse.ReplayedMessage(adapted));
                            }
                        }
                    }
                }

                outcome.deliverAll(replyTo, replayed);
                outcome.deliver(replyTo, new JournalResponse.RecoverySuccess(highestSequenceNr));
            } catch (Exception e) {
                logger.debug("Replay of {} failed", request.persistenceId(), e);
                outcome.deliver(replyTo, new JournalResponse.ReplayMessagesFailure(e));
            }
            return null;
        }

        @Override
        public Void visitReadHighest(ReadHighestSequenceNr request) {
            try {
                long highestSequenceNr = readHighestSequenceNr(request.persistenceId());
                outcome.deliver(request.replyTo(), new JournalResponse.ReadHighestSequenceNrSuccess(highestSequenceNr));
            } catch (Exception e) {
                logger.debug("Reading highest sequence number of {} failed", request.persistenceId(), e);
                outcome.deliver(request.replyTo(), new JournalResponse.ReadHighestSequenceNrFailure(e));
            }
            return null;
        }

        @Override
        public Void visitDelete(DeleteMessagesTo request) {
            long toSequenceNr = request.toSequenceNr();
            try {
                long highestSequenceNr = readHighestSequenceNr(request.persistenceId());

                PreparedStatement delete = statements.prepare(sql.deleteBatch());
                delete.setString(1, request.persistenceId());
                delete.setLong(2, toSequenceNr);
                delete.executeUpdate();

                if (highestSequenceNr <= toSequenceNr) {
                    PreparedStatement upsert = statements.prepare(sql.upsertMetadataSequenceNr());
                    upsert.setString(1, request.persistenceId());
                    upsert.setLong(2, highestSequenceNr);
                    upsert.executeUpdate();
                }

                outcome.deliver(request.replyTo(), new JournalResponse.DeleteMessagesSuccess(toSequenceNr));
            } catch (Exception e) {
                logger.debug("Deleting {} up to {} failed", request.persistenceId(), toSequenceNr, e);
                outcome.deliver(request.replyTo(), new JournalResponse.DeleteMessagesFailure(e, toSequenceNr));
            }
            return null;
        }

        @Override
        public Void visitReplayTagged(ReplayTaggedMessages request) {
            Pid replyTo = request.replyTo();
            try {
                String tag = request.tag();
                long take = Math.min(span(request.fromOffset(), request.toOffset()), request.max());
                long maxSequenceNr = 0L;
                List<JournalResponse> replayed = new ArrayList<>();

                if (take > 0) {
                    PreparedStatement select = statements.prepare(sql.selectByTag());
                    select.setLong(1, request.fromOffset());
                    select.setLong(2, request.toOffset());
                    select.setString(3, sql.tagPattern(tag));
                    select.setMaxRows((int) Math.min(take, Integer.MAX_VALUE));
                    try (ResultSet rs = select.executeQuery()) {
                        while (rs.next()) {
                            long ordering = rs.getLong(1);
                            PersistentRecord stored = readRecord(rs, 2);
                            maxSequenceNr = Math.max(maxSequenceNr, stored.sequenceNr());
                            for (PersistentRecord adapted : eventAdapter.fromJournal(stored)) {
                                replayed.add(new JournalResponse.ReplayedTaggedMessage(adapted, tag, ordering));
                            }
                        }
                    }
                }

                outcome.deliverAll(replyTo, replayed);
                outcome.deliver(replyTo, new JournalResponse.RecoverySuccess(maxSequenceNr));
            } catch (Exception e) {
                logger.debug("Replay of tag {} failed", request.tag(), e);
                outcome.deliver(replyTo, new JournalResponse.ReplayMessagesFailure(e));
            }
            return null;
        }

        private long readHighestSequenceNr(String persistenceId) throws SQLException {
            PreparedStatement select = statements.prepare(sql.selectHighestSequenceNr());
            select.setString(1, persistenceId);
            select.setString(2, persistenceId);
            try (ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    return 0L;
                }
                long highest = rs.getLong(1);
                return rs.wasNull() ? 0L : highest;
            }
        }

        /**
         * Reads the event columns starting at {@code first}: persistence id, sequence nr,
         * is-deleted, manifest, payload, timestamp.
         */
        private PersistentRecord readRecord(ResultSet rs, int first) throws SQLException {
            String persistenceId = rs.getString(first);
            long sequenceNr = rs.getLong(first + 1);
            boolean deleted = rs.getBoolean(first + 2);
            String manifest = rs.getString(first + 3);
            byte[] bytes = rs.getBytes(first + 4);
            long timestamp = rs.getLong(first + 5);
            Object payload;
            try {
                payload = serializer.deserialize(bytes, manifest);
            } catch (PayloadSerializationException e) {
                throw new JournalException.CorruptedDataException(
                        "Failed to read event of " + persistenceId, sequenceNr, e);
            }
            return new PersistentRecord(persistenceId, sequenceNr, payload, manifest, deleted, "", timestamp);
        }
    }

    private static long span(long fromOffset, long toOffset) {
        if (toOffset <= fromOffset) {
            return 0L;
        }
        long span = toOffset - fromOffset;
        return span < 0 ? Long.MAX_VALUE : span;
    }
}
