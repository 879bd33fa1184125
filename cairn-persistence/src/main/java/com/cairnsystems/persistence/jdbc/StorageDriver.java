package com.cairnsystems.persistence.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Access to the relational store backing a journal.
 */
public interface StorageDriver extends AutoCloseable {

    /**
     * Prepares the driver for use. Called once when the journal starts.
     */
    void open();

    /**
     * @return a new connection in auto-commit mode; the caller closes it
     * @throws SQLException if the store cannot be reached
     */
    Connection openConnection() throws SQLException;

    JournalStatements statements();

    /**
     * Releases whatever {@link #open()} acquired. Connections handed out earlier are not affected.
     */
    @Override
    void close();
}
