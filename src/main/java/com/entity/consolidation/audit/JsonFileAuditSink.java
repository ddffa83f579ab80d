package com.entity.consolidation.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the whole audit trail as one JSON array, replacing the file on every flush.
 * The new content goes to a sibling temp file first, so a crash mid-write leaves the
 * previous checkpoint intact.
 */
public class JsonFileAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(JsonFileAuditSink.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileAuditSink(Path path) {
        this(path, AuditJson.objectMapper());
    }

    public JsonFileAuditSink(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public void persist(List<AuditEntry> entries) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), entries);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        log.debug("audit.file.written path={} entries={}", absolute, entries.size());
    }

    /**
     * Reads a previously written audit file.
     */
    public List<AuditEntry> read() throws IOException {
        return List.of(objectMapper.readValue(path.toFile(), AuditEntry[].class));
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String describe() {
        return "file " + path;
    }
}
