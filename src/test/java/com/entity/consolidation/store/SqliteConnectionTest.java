package com.entity.consolidation.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SqliteConnection.
 */
class SqliteConnectionTest {

    @TempDir
    Path tempDir;

    @Test
    void queryReturnsRowsByColumnLabel() throws SQLException {
        try (SqliteConnection connection = SqliteConnection.inMemory()) {
            connection.update("CREATE TABLE t (id INTEGER, name TEXT)");
            connection.update("INSERT INTO t VALUES (?, ?)", 1, "a");

            List<Map<String, Object>> rows = connection.query("SELECT id AS ident, name FROM t WHERE id = ?", 1);

            assertEquals(1, rows.size());
            assertEquals(1, ((Number) rows.get(0).get("ident")).intValue());
            assertEquals("a", rows.get(0).get("name"));
        }
    }

    @Test
    void schemaInspection() throws SQLException {
        try (SqliteConnection connection = SqliteConnection.inMemory()) {
            connection.update("CREATE TABLE entities (id INTEGER, Full_Name TEXT)");

            assertTrue(connection.tableExists("entities"));
            assertTrue(connection.columnExists("entities", "full_name"));
            assertFalse(connection.columnExists("entities", "aliases"));
            assertFalse(connection.tableExists("people"));
        }
    }

    @Test
    void schemaChangesRefreshColumnLookups() throws SQLException {
        try (SqliteConnection connection = SqliteConnection.inMemory()) {
            connection.update("CREATE TABLE entities (id INTEGER)");
            assertFalse(connection.columnExists("entities", "aliases"));

            connection.update("ALTER TABLE entities ADD COLUMN aliases TEXT");

            assertTrue(connection.columnExists("entities", "aliases"));
        }
    }

    @Test
    void identifiersAreValidated() throws SQLException {
        try (SqliteConnection connection = SqliteConnection.inMemory()) {
            assertThrows(IllegalArgumentException.class, () -> connection.tableExists("entities; DROP TABLE x"));
        }
    }

    @Test
    void rollbackDiscardsTransaction() throws SQLException {
        try (SqliteConnection connection = SqliteConnection.inMemory()) {
            connection.update("CREATE TABLE t (id INTEGER)");
            connection.beginTransaction();
            connection.update("INSERT INTO t VALUES (1)");
            connection.rollback();

            assertEquals(0, TestArchive.on(connection).count("SELECT COUNT(*) FROM t"));
        }
    }

    @Test
    void readOnlyConnectionRejectsWrites() throws SQLException {
        Path file = TestArchive.createFile(tempDir, "archive.db");

        try (SqliteConnection connection = SqliteConnection.open(file, true)) {
            assertTrue(connection.isReadOnly());
            assertTrue(connection.isConnected());
            assertThrows(SQLException.class,
                    () -> connection.update("INSERT INTO entities (full_name) VALUES ('x')"));
        }
    }
}
