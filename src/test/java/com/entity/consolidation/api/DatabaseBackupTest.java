package com.entity.consolidation.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DatabaseBackup.
 */
class DatabaseBackupTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:30:15Z"), ZoneOffset.UTC);

    @Test
    void copiesDatabaseWithTimestampedName() throws IOException {
        Path db = Files.writeString(tempDir.resolve("archive.db"), "sqlite bytes");
        Path backupDir = tempDir.resolve("backups");

        Path backup = new DatabaseBackup(backupDir, clock).create(db);

        assertEquals(backupDir.resolve("archive_backup_20240305_143015.db"), backup);
        assertEquals("sqlite bytes", Files.readString(backup));
    }

    @Test
    void sameSecondDoesNotOverwrite() throws IOException {
        Path db = Files.writeString(tempDir.resolve("archive.db"), "v1");
        DatabaseBackup backup = new DatabaseBackup(tempDir.resolve("backups"), clock);

        Path first = backup.create(db);
        Path second = backup.create(db);

        assertNotEquals(first, second);
        assertTrue(second.getFileName().toString().endsWith("_1.db"));
    }

    @Test
    void missingDatabaseIsFatal() {
        DatabaseBackup backup = new DatabaseBackup(tempDir.resolve("backups"), clock);

        assertThrows(ConsolidationException.class, () -> backup.create(tempDir.resolve("missing.db")));
    }
}
