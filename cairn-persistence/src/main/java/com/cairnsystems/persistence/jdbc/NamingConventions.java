package com.cairnsystems.persistence.jdbc;

/**
 * Schema, table and column names used by the journal's SQL statements.
 */
public class NamingConventions {

    // Tables
    private String schemaName = null;
    private String journalTableName = "event_journal";
    private String metadataTableName = "metadata";

    // Journal columns
    private String orderingColumnName = "ordering";
    private String persistenceIdColumnName = "persistence_id";
    private String sequenceNrColumnName = "sequence_nr";
    private String payloadColumnName = "payload";
    private String manifestColumnName = "manifest";
    private String timestampColumnName = "created_at";
    private String isDeletedColumnName = "is_deleted";
    private String tagsColumnName = "tags";

    // Metadata columns
    private String metadataPersistenceIdColumnName = "persistence_id";
    private String metadataSequenceNrColumnName = "sequence_nr";

    public static NamingConventions defaults() {
        return new NamingConventions();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final NamingConventions naming = new NamingConventions();

        public Builder schemaName(String schemaName) {
            naming.schemaName = schemaName;
            return this;
        }

        public Builder journalTableName(String name) {
            naming.journalTableName = name;
            return this;
        }

        public Builder metadataTableName(String name) {
            naming.metadataTableName = name;
            return this;
        }

        public Builder orderingColumnName(String name) {
            naming.orderingColumnName = name;
            return this;
        }

        public Builder persistenceIdColumnName(String name) {
            naming.persistenceIdColumnName = name;
            return this;
        }

        public Builder sequenceNrColumnName(String name) {
            naming.sequenceNrColumnName = name;
            return this;
        }

        public Builder payloadColumnName(String name) {
            naming.payloadColumnName = name;
            return this;
        }

        public Builder manifestColumnName(String name) {
            naming.manifestColumnName = name;
            return this;
        }

        public Builder timestampColumnName(String name) {
            naming.timestampColumnName = name;
            return this;
        }

        public Builder isDeletedColumnName(String name) {
            naming.isDeletedColumnName = name;
            return this;
        }

        public Builder tagsColumnName(String name) {
            naming.tagsColumnName = name;
            return this;
        }

        public Builder metadataPersistenceIdColumnName(String name) {
            naming.metadataPersistenceIdColumnName = name;
            return this;
        }

        public Builder metadataSequenceNrColumnName(String name) {
            naming.metadataSequenceNrColumnName = name;
            return this;
        }

        public NamingConventions build() {
            naming.validate();
            return naming;
        }
    }

    private void validate() {
        requireName(journalTableName, "Journal table name");
        requireName(metadataTableName, "Metadata table name");
        requireName(orderingColumnName, "Ordering column name");
        requireName(persistenceIdColumnName, "Persistence id column name");
        requireName(sequenceNrColumnName, "Sequence number column name");
        requireName(payloadColumnName, "Payload column name");
        requireName(manifestColumnName, "Manifest column name");
        requireName(timestampColumnName, "Timestamp column name");
        requireName(isDeletedColumnName, "Is-deleted column name");
        requireName(tagsColumnName, "Tags column name");
        requireName(metadataPersistenceIdColumnName, "Metadata persistence id column name");
        requireName(metadataSequenceNrColumnName, "Metadata sequence number column name");
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be empty");
        }
    }

    /**
     * @return the journal table name, qualified with the schema when one is set
     */
    public String fullJournalTableName() {
        return qualify(journalTableName);
    }

    /**
     * @return the metadata table name, qualified with the schema when one is set
     */
    public String fullMetadataTableName() {
        return qualify(metadataTableName);
    }

    private String qualify(String table) {
        return schemaName == null || schemaName.isBlank() ? table : schemaName + "." + table;
    }

    public String getSchemaName() { return schemaName; }
    public String getJournalTableName() { return journalTableName; }
    public String getMetadataTableName() { return metadataTableName; }
    public String getOrderingColumnName() { return orderingColumnName; }
    public String getPersistenceIdColumnName() { return persistenceIdColumnName; }
    public String getSequenceNrColumnName() { return sequenceNrColumnName; }
    public String getPayloadColumnName() { return payloadColumnName; }
    public String getManifestColumnName() { return manifestColumnName; }
    public String getTimestampColumnName() { return timestampColumnName; }
    public String getIsDeletedColumnName() { return isDeletedColumnName; }
    public String getTagsColumnName() { return tagsColumnName; }
    public String getMetadataPersistenceIdColumnName() { return metadataPersistenceIdColumnName; }
    public String getMetadataSequenceNrColumnName() { return metadataSequenceNrColumnName; }

    @Override
    public String toString() {
        return "NamingConventions{" +
                "journalTable=" + fullJournalTableName() +
                ", metadataTable=" + fullMetadataTableName() +
                '}';
    }
}
