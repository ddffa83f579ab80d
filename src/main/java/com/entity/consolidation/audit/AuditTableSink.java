package com.entity.consolidation.audit;

import com.entity.consolidation.store.DatabaseConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

/**
 * Appends merges to the archive's {@code audit_log} table, one row per entry.
 * Creates the table if it does not exist.
 */
public class AuditTableSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(AuditTableSink.class);

    static final String ACTION = "ENTITY_MERGED";
    static final String OBJECT_TYPE = "entity";

    private final DatabaseConnection connection;
    private final ObjectMapper objectMapper;
    private final String userId;
    private int written = 0;
    private boolean tableReady = false;

    public AuditTableSink(DatabaseConnection connection, String userId) {
        this.connection = connection;
        this.userId = userId;
        this.objectMapper = AuditJson.objectMapper()
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void persist(List<AuditEntry> entries) throws IOException {
        try {
            ensureTable();
            for (int i = written; i < entries.size(); i++) {
                AuditEntry entry = entries.get(i);
                connection.update("""
                        INSERT INTO audit_log (timestamp, user_id, action, object_type, object_id, payload_json)
                        VALUES (?, ?, ?, ?, ?, ?)
                        """,
                        entry.timestamp().toString(), userId, ACTION, OBJECT_TYPE,
                        String.valueOf(entry.sourceId()), objectMapper.writeValueAsString(entry));
                written = i + 1;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to write audit_log: " + e.getMessage(), e);
        }
        log.debug("audit.table.written rows={}", written);
    }

    private void ensureTable() throws SQLException {
        if (tableReady) {
            return;
        }
        connection.update("""
                CREATE TABLE IF NOT EXISTS audit_log (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    timestamp TEXT NOT NULL,
                    user_id TEXT,
                    action TEXT NOT NULL,
                    object_type TEXT,
                    object_id TEXT,
                    payload_json TEXT
                )
                """);
        tableReady = true;
    }

    @Override
    public String describe() {
        return "table audit_log";
    }
}
