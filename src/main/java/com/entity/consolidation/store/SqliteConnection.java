package com.entity.consolidation.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SQLite implementation using the Xerial JDBC driver.
 * A read-only connection is opened with SQLite's own read-only flag, so any write attempt
 * fails inside the driver.
 */
public class SqliteConnection implements DatabaseConnection {
    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private static final int BUSY_TIMEOUT_MILLIS = 5_000;

    private final Connection connection;
    private final String databasePath;
    private final boolean readOnly;
    private final Map<String, Set<String>> columnCache = new ConcurrentHashMap<>();

    private SqliteConnection(Connection connection, String databasePath, boolean readOnly) {
        this.connection = connection;
        this.databasePath = databasePath;
        this.readOnly = readOnly;
    }

    /**
     * Opens a database file.
     *
     * @throws SQLException if the file cannot be opened
     */
    public static SqliteConnection open(Path databaseFile, boolean readOnly) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        String url = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        Connection connection = config.createConnection(url);
        log.info("SQLite connection opened path={} readOnly={}", databaseFile, readOnly);
        return new SqliteConnection(connection, databaseFile.toString(), readOnly);
    }

    /**
     * Opens a private in-memory database, used by tests and tooling.
     */
    public static SqliteConnection inMemory() throws SQLException {
        Connection connection = new SQLiteConfig().createConnection("jdbc:sqlite::memory:");
        return new SqliteConnection(connection, ":memory:", false);
    }

    @Override
    public int update(String sql, Object... params) throws SQLException {
        log.trace("Executing: {}", sql);
        try (PreparedStatement statement = prepare(sql, params)) {
            return statement.executeUpdate();
        } finally {
            if (isSchemaChange(sql)) {
                columnCache.clear();
            }
        }
    }

    private static boolean isSchemaChange(String sql) {
        String head = sql.stripLeading().toUpperCase(Locale.ROOT);
        return head.startsWith("CREATE") || head.startsWith("ALTER") || head.startsWith("DROP");
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... params) throws SQLException {
        log.trace("Querying: {}", sql);
        try (PreparedStatement statement = prepare(sql, params);
             ResultSet resultSet = statement.executeQuery()) {
            ResultSetMetaData meta = resultSet.getMetaData();
            int columns = meta.getColumnCount();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (resultSet.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), resultSet.getObject(i));
                }
                rows.add(row);
            }
            return rows;
        }
    }

    @Override
    public void beginTransaction() throws SQLException {
        connection.setAutoCommit(false);
    }

    @Override
    public void commit() throws SQLException {
        connection.commit();
        connection.setAutoCommit(true);
    }

    @Override
    public void rollback() throws SQLException {
        if (!connection.getAutoCommit()) {
            connection.rollback();
            connection.setAutoCommit(true);
        }
    }

    @Override
    public boolean tableExists(String table) throws SQLException {
        return !columns(table).isEmpty();
    }

    @Override
    public boolean columnExists(String table, String column) throws SQLException {
        return columns(table).contains(column.toLowerCase(Locale.ROOT));
    }

    private Set<String> columns(String table) throws SQLException {
        Set<String> cached = columnCache.get(table);
        if (cached != null) {
            return cached;
        }
        SqlIdentifiers.requireValid(table);
        List<Map<String, Object>> info = query("PRAGMA table_info(" + table + ")");
        Set<String> names = new HashSet<>();
        for (Map<String, Object> row : info) {
            names.add(String.valueOf(row.get("name")).toLowerCase(Locale.ROOT));
        }
        Set<String> result = Set.copyOf(names);
        columnCache.put(table, result);
        return result;
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public boolean isConnected() {
        try {
            return !connection.isClosed() && connection.isValid(1);
        } catch (SQLException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getDatabasePath() {
        return databasePath;
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing SQLite connection", e);
        }
        log.info("SQLite connection closed path={}", databasePath);
    }
}
