package com.cairnsystems.persistence.jdbc;

/**
 * SQL dialect of the journal. Every statement is a parameterised JDBC string; the parameter order
 * of each one is documented on its method.
 */
public interface JournalStatements {

    NamingConventions naming();

    String createJournalTable();

    String createMetadataTable();

    /**
     * Parameters: persistence id, sequence nr, timestamp, is-deleted, manifest, payload, tags.
     */
    String insertEvent();

    /**
     * Highest sequence number over journal rows and the metadata marker of one stream.
     * Parameters: persistence id (journal), persistence id (metadata). Returns one row whose
     * single column is NULL when the stream is unknown.
     */
    String selectHighestSequenceNr();

    /**
     * Parameters: persistence id, from sequence nr (inclusive), to sequence nr (inclusive).
     * Rows come in ascending sequence order.
     */
    String selectByPersistenceIdRange();

    /**
     * Parameters: from ordering (exclusive), to ordering (inclusive), tag pattern built by
     * {@link #tagPattern(String)}. Rows come in ascending ordering.
     */
    String selectByTag();

    /**
     * Parameters: persistence id, to sequence nr (inclusive).
     */
    String deleteBatch();

    /**
     * Inserts or overwrites the metadata marker of a stream.
     * Parameters: persistence id, sequence nr.
     */
    String upsertMetadataSequenceNr();

    String selectAllPersistenceIds();

    /**
     * @param tag a tag name
     * @return the match pattern for {@link #selectByTag()}, with pattern characters of the tag escaped
     */
    String tagPattern(String tag);
}
