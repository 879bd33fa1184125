package com.cairnsystems.persistence.jdbc;

import com.cairnsystems.persistence.journal.Tagged;

/**
 * HSQLDB dialect. Tags are stored as one delimited string ({@code ;a;b;}) and matched with
 * {@code LIKE}.
 */
public class HsqldbJournalStatements implements JournalStatements {

    private static final char ESCAPE = '\\';

    private final NamingConventions naming;

    private final String createJournalTable;
    private final String createMetadataTable;
    private final String insertEvent;
    private final String selectHighestSequenceNr;
    private final String selectByPersistenceIdRange;
    private final String selectByTag;
    private final String deleteBatch;
    private final String upsertMetadataSequenceNr;
    private final String selectAllPersistenceIds;

    public HsqldbJournalStatements(NamingConventions naming) {
        this.naming = naming;

        String journal = naming.fullJournalTableName();
        String metadata = naming.fullMetadataTableName();
        String ordering = naming.getOrderingColumnName();
        String persistenceId = naming.getPersistenceIdColumnName();
        String sequenceNr = naming.getSequenceNrColumnName();
        String payload = naming.getPayloadColumnName();
        String manifest = naming.getManifestColumnName();
        String timestamp = naming.getTimestampColumnName();
        String isDeleted = naming.getIsDeletedColumnName();
        String tags = naming.getTagsColumnName();
        String metaPersistenceId = naming.getMetadataPersistenceIdColumnName();
        String metaSequenceNr = naming.getMetadataSequenceNrColumnName();

        String eventColumns = persistenceId + ", " + sequenceNr + ", " + isDeleted + ", "
                + manifest + ", " + payload + ", " + timestamp;

        this.createJournalTable = "CREATE TABLE IF NOT EXISTS " + journal + " ("
                + ordering + " BIGINT GENERATED BY DEFAULT AS IDENTITY (START WITH 1) PRIMARY KEY, "
                + persistenceId + " VARCHAR(255) NOT NULL, "
                + sequenceNr + " BIGINT NOT NULL, "
                + isDeleted + " BOOLEAN DEFAULT FALSE NOT NULL, "
                + timestamp + " BIGINT NOT NULL, "
                + manifest + " VARCHAR(500) NOT NULL, "
                + payload + " VARBINARY(1048576) NOT NULL, "
                + tags + " VARCHAR(2000), "
                + "CONSTRAINT " + naming.getJournalTableName() + "_uq UNIQUE (" + persistenceId + ", " + sequenceNr + "))";

        this.createMetadataTable = "CREATE TABLE IF NOT EXISTS " + metadata + " ("
                + metaPersistenceId + " VARCHAR(255) NOT NULL, "
                + metaSequenceNr + " BIGINT NOT NULL, "
                + "PRIMARY KEY (" + metaPersistenceId + "))";

        this.insertEvent = "INSERT INTO " + journal + " ("
                + persistenceId + ", " + sequenceNr + ", " + timestamp + ", " + isDeleted + ", "
                + manifest + ", " + payload + ", " + tags + ") VALUES (?, ?, ?, ?, ?, ?, ?)";

        this.selectHighestSequenceNr = "SELECT MAX(u.seq) FROM ("
                + "SELECT MAX(e." + sequenceNr + ") AS seq FROM " + journal + " e WHERE e." + persistenceId + " = ? "
                + "UNION "
                + "SELECT m." + metaSequenceNr + " AS seq FROM " + metadata + " m WHERE m." + metaPersistenceId + " = ?"
                + ") AS u";

        this.selectByPersistenceIdRange = "SELECT " + eventColumns + " FROM " + journal
                + " WHERE " + persistenceId + " = ? AND " + sequenceNr + " >= ? AND " + sequenceNr + " <= ?"
                + " ORDER BY " + sequenceNr + " ASC";

        this.selectByTag = "SELECT " + ordering + ", " + eventColumns + " FROM " + journal
                + " WHERE " + ordering + " > ? AND " + ordering + " <= ? AND " + tags + " LIKE ? ESCAPE '" + ESCAPE + "'"
                + " ORDER BY " + ordering + " ASC";

        this.deleteBatch = "DELETE FROM " + journal
                + " WHERE " + persistenceId + " = ? AND " + sequenceNr + " <= ?";

        this.upsertMetadataSequenceNr = "MERGE INTO " + metadata + " m"
                + " USING (VALUES (CAST(? AS VARCHAR(255)), CAST(? AS BIGINT))) AS v(pid, seq)"
                + " ON m." + metaPersistenceId + " = v.pid"
                + " WHEN MATCHED THEN UPDATE SET " + metaSequenceNr + " = v.seq"
                + " WHEN NOT MATCHED THEN INSERT (" + metaPersistenceId + ", " + metaSequenceNr + ") VALUES (v.pid, v.seq)";

        this.selectAllPersistenceIds = "SELECT DISTINCT " + persistenceId + " FROM " + journal;
    }

    @Override
    public NamingConventions naming() {
        return naming;
    }

    @Override
    public String createJournalTable() {
        return createJournalTable;
    }

    @Override
    public String createMetadataTable() {
        return createMetadataTable;
    }

    @Override
    public String insertEvent() {
        return insertEvent;
    }

    @Override
    public String selectHighestSequenceNr() {
        return selectHighestSequenceNr;
    }

    @Override
    public String selectByPersistenceIdRange() {
        return selectByPersistenceIdRange;
    }

    @Override
    public String selectByTag() {
        return selectByTag;
    }

    @Override
    public String deleteBatch() {
        return deleteBatch;
    }

    @Override
    public String upsertMetadataSequenceNr() {
        return upsertMetadataSequenceNr;
    }

    @Override
    public String selectAllPersistenceIds() {
        return selectAllPersistenceIds;
    }

    @Override
    public String tagPattern(String tag) {
        StringBuilder pattern = new StringBuilder(tag.length() + 6);
        pattern.append('%').append(Tagged.DELIMITER);
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            if (c == '%' || c == '_' || c == ESCAPE) {
                pattern.append(ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append(Tagged.DELIMITER).append('%').toString();
    }
}
