package com.entity.consolidation.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Copies the database file aside before a live run.
 * Backups are named {@code <stem>_backup_<yyyyMMdd_HHmmss><ext>} inside the backup directory.
 */
public class DatabaseBackup {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBackup.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path backupDir;
    private final Clock clock;

    public DatabaseBackup(Path backupDir) {
        this(backupDir, Clock.systemDefaultZone());
    }

    public DatabaseBackup(Path backupDir, Clock clock) {
        this.backupDir = backupDir;
        this.clock = clock;
    }

    /**
     * Copies {@code database} into the backup directory.
     *
     * @return the backup file
     * @throws ConsolidationException if the copy fails
     */
    public Path create(Path database) {
        String fileName = database.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        String base = stem + "_backup_" + LocalDateTime.now(clock).format(STAMP);

        try {
            Files.createDirectories(backupDir);
            Path target = backupDir.resolve(base + extension);
            for (int n = 1; Files.exists(target); n++) {
                target = backupDir.resolve(base + "_" + n + extension);
            }
            Files.copy(database, target);
            log.info("backup.created source={} backup={} bytes={}", database, target, Files.size(target));
            return target;
        } catch (IOException e) {
            throw new ConsolidationException("Could not back up " + database + " to " + backupDir, e);
        }
    }
}
