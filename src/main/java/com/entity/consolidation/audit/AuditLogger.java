package com.entity.consolidation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only audit trail of one run.
 * Entries are held in memory and pushed to every sink at each checkpoint and on {@link #flush()}.
 */
public class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final List<AuditEntry> entries = new ArrayList<>();
    private final List<AuditSink> sinks;
    private final int checkpointInterval;

    /**
     * @param checkpointInterval flush after this many appended entries; 0 flushes only on demand
     */
    public AuditLogger(List<AuditSink> sinks, int checkpointInterval) {
        if (checkpointInterval < 0) {
            throw new IllegalArgumentException("checkpointInterval must be >= 0");
        }
        this.sinks = List.copyOf(sinks);
        this.checkpointInterval = checkpointInterval;
    }

    /**
     * An audit trail kept only in memory.
     */
    public static AuditLogger inMemory() {
        return new AuditLogger(List.of(), 0);
    }

    /**
     * Records a completed merge.
     */
    public AuditEntry append(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} -> {} ({})", entry.sourceId(), entry.targetId(), entry.method());
        if (checkpointInterval > 0 && entries.size() % checkpointInterval == 0) {
            checkpoint();
        }
        return entry;
    }

    private void checkpoint() {
        try {
            flush();
            log.info("audit.checkpoint entries={}", entries.size());
        } catch (AuditException e) {
            // retried by the final flush
            log.warn("audit.checkpoint.failed entries={} error={}", entries.size(), e.getMessage());
        }
    }

    /**
     * Writes every entry to every sink.
     *
     * @throws AuditException if any sink fails; the remaining sinks are still attempted
     */
    public void flush() {
        AuditException failure = null;
        List<AuditEntry> snapshot = getEntries();
        for (AuditSink sink : sinks) {
            try {
                sink.persist(snapshot);
            } catch (IOException | RuntimeException e) {
                log.error("audit.flush.failed sink={} error={}", sink.describe(), e.getMessage(), e);
                if (failure == null) {
                    failure = new AuditException("Failed to write audit to " + sink.describe(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Entries where the entity was either merged away or merged into.
     */
    public List<AuditEntry> getEntriesForEntity(long entityId) {
        return entries.stream()
                .filter(e -> e.sourceId() == entityId || e.targetId() == entityId)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    public int getTotalMentionsTransferred() {
        return entries.stream().mapToInt(AuditEntry::mentionsTransferred).sum();
    }

    public boolean hasSinks() {
        return !sinks.isEmpty();
    }
}
