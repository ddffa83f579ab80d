package com.entity.consolidation.store;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Connection to the archive database.
 * Abstracts the underlying JDBC driver; statements use positional {@code ?} parameters.
 */
public interface DatabaseConnection extends AutoCloseable {

    /**
     * Executes an INSERT, UPDATE or DELETE statement.
     *
     * @return number of rows changed
     */
    int update(String sql, Object... params) throws SQLException;

    /**
     * Executes a query and returns every row as a column-label → value map.
     */
    List<Map<String, Object>> query(String sql, Object... params) throws SQLException;

    /**
     * Starts a transaction. Statements run in auto-commit mode until this is called.
     */
    void beginTransaction() throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    /**
     * Whether the table exists in the connected database.
     */
    boolean tableExists(String table) throws SQLException;

    /**
     * Whether the table exists and has the column.
     */
    boolean columnExists(String table, String column) throws SQLException;

    /**
     * Whether the connection was opened without write access.
     */
    boolean isReadOnly();

    /**
     * Checks if the connection is alive.
     */
    boolean isConnected();

    /**
     * Location of the database, for logging.
     */
    String getDatabasePath();

    @Override
    void close();
}
