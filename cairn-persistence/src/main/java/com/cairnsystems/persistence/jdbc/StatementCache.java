package com.cairnsystems.persistence.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Prepared statements of one chunk, reused by every request of the chunk and closed with it.
 */
class StatementCache implements AutoCloseable {

    private final Connection connection;
    private final int queryTimeoutSeconds;
    private final Map<String, PreparedStatement> statements = new HashMap<>();

    StatementCache(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * @param sql statement text
     * @return the statement for {@code sql} with its parameters cleared and no row limit
     */
    PreparedStatement prepare(String sql) throws SQLException {
        PreparedStatement statement = statements.get(sql);
        if (statement == null) {
            statement = connection.prepareStatement(sql);
            statement.setQueryTimeout(queryTimeoutSeconds);
            statements.put(sql, statement);
        } else {
            statement.clearParameters();
            statement.setMaxRows(0);
        }
        return statement;
    }

    @Override
    public void close() throws SQLException {
        SQLException failure = null;
        for (PreparedStatement statement : statements.values()) {
            try {
                statement.close();
            } catch (SQLException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        statements.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
