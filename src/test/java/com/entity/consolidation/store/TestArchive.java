package com.entity.consolidation.store;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Builds small archive databases for tests.
 */
public final class TestArchive {

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE entities (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                full_name TEXT NOT NULL,
                entity_type TEXT,
                mentions INTEGER DEFAULT 0,
                aliases TEXT
            )""",
            """
            CREATE TABLE entity_mentions (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                entity_id INTEGER NOT NULL,
                document_id INTEGER NOT NULL,
                context TEXT,
                UNIQUE (entity_id, document_id)
            )""",
            "CREATE TABLE media_items (id INTEGER PRIMARY KEY, entity_id INTEGER, title TEXT)",
            "CREATE TABLE organizations (id INTEGER PRIMARY KEY, entity_id INTEGER UNIQUE, name TEXT)",
            """
            CREATE TABLE entity_evidence_types (
                entity_id INTEGER NOT NULL,
                evidence_type_id INTEGER NOT NULL,
                PRIMARY KEY (entity_id, evidence_type_id)
            )""",
            "CREATE TABLE people (id INTEGER PRIMARY KEY, entity_id INTEGER UNIQUE, name TEXT)",
            """
            CREATE TABLE entity_documents (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                entity_id INTEGER NOT NULL,
                document_id INTEGER NOT NULL,
                UNIQUE (entity_id, document_id)
            )""",
            "CREATE TABLE black_book_entries (id INTEGER PRIMARY KEY AUTOINCREMENT, person_id INTEGER, note TEXT)",
            """
            CREATE TABLE entity_relationships (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                source_entity_id INTEGER NOT NULL,
                target_entity_id INTEGER NOT NULL,
                relationship_type TEXT NOT NULL,
                UNIQUE (source_entity_id, target_entity_id, relationship_type)
            )"""
    );

    private final DatabaseConnection connection;

    private TestArchive(DatabaseConnection connection) {
        this.connection = connection;
    }

    /**
     * Creates the full archive schema in a new database file.
     */
    public static Path createFile(Path dir, String name) throws SQLException {
        Path file = dir.resolve(name);
        try (SqliteConnection connection = SqliteConnection.open(file, false)) {
            new TestArchive(connection).createSchema();
        }
        return file;
    }

    public static TestArchive on(DatabaseConnection connection) {
        return new TestArchive(connection);
    }

    public TestArchive createSchema() throws SQLException {
        for (String ddl : SCHEMA) {
            connection.update(ddl);
        }
        return this;
    }

    public TestArchive entity(long id, String name, String type, int mentions) throws SQLException {
        connection.update("INSERT INTO entities (id, full_name, entity_type, mentions) VALUES (?, ?, ?, ?)",
                id, name, type, mentions);
        return this;
    }

    public TestArchive person(long id, String name, int mentions) throws SQLException {
        return entity(id, name, "Person", mentions);
    }

    public TestArchive aliases(long id, String json) throws SQLException {
        connection.update("UPDATE entities SET aliases = ? WHERE id = ?", json, id);
        return this;
    }

    public TestArchive mention(long entityId, long documentId) throws SQLException {
        connection.update("INSERT INTO entity_mentions (entity_id, document_id) VALUES (?, ?)", entityId, documentId);
        return this;
    }

    public TestArchive insert(String sql, Object... params) throws SQLException {
        connection.update(sql, params);
        return this;
    }

    /**
     * First column of the first row, as a long.
     */
    public long count(String sql, Object... params) throws SQLException {
        List<Map<String, Object>> rows = connection.query(sql, params);
        return ((Number) rows.get(0).values().iterator().next()).longValue();
    }
}
