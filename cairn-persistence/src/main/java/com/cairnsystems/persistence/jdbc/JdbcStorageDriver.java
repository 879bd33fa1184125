package com.cairnsystems.persistence.jdbc;

import com.cairnsystems.persistence.JournalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * {@link StorageDriver} over {@link DriverManager}. Every call to {@link #openConnection()} opens a
 * new physical connection; with {@code keepAnchorConnection} one more connection is held from
 * {@link #open()} to {@link #close()} so that in-memory databases survive between chunks.
 */
public class JdbcStorageDriver implements StorageDriver {

    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageDriver.class);

    private final JournalSettings settings;
    private final JournalStatements statements;
    private volatile Connection anchor;

    /**
     * Uses the HSQLDB dialect; the HSQLDB driver ships with this module at runtime scope.
     * Other databases go through {@link #JdbcStorageDriver(JournalSettings, JournalStatements)}.
     */
    public JdbcStorageDriver(JournalSettings settings) {
        this(settings, new HsqldbJournalStatements(settings.getNamingConventions()));
    }

    public JdbcStorageDriver(JournalSettings settings, JournalStatements statements) {
        this.settings = settings;
        this.statements = statements;
    }

    @Override
    public synchronized void open() {
        if (!settings.isKeepAnchorConnection() || anchor != null) {
            return;
        }
        try {
            anchor = openConnection();
            logger.debug("Opened anchor connection to {}", settings.getConnectionUrl());
        } catch (SQLException e) {
            throw new JournalException.StorageException(
                    "Failed to open anchor connection to " + settings.getConnectionUrl(), e);
        }
    }

    @Override
    public Connection openConnection() throws SQLException {
        DriverManager.setLoginTimeout((int) settings.getConnectionTimeout().toSeconds());
        return DriverManager.getConnection(settings.getConnectionUrl(), settings.getUser(), settings.getPassword());
    }

    @Override
    public JournalStatements statements() {
        return statements;
    }

    @Override
    public synchronized void close() {
        if (anchor == null) {
            return;
        }
        try {
            anchor.close();
        } catch (SQLException e) {
            logger.warn("Failed to close anchor connection to {}", settings.getConnectionUrl(), e);
        } finally {
            anchor = null;
        }
    }
}
