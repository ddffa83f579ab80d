package com.entity.consolidation.audit;

import java.io.IOException;
import java.util.List;

/**
 * Durable destination for the audit trail.
 */
public interface AuditSink {

    /**
     * Persists the run's entries. Called with the full list every time; the list only grows
     * between calls, so a sink may write just the entries it has not seen yet.
     */
    void persist(List<AuditEntry> entries) throws IOException;

    /**
     * Where the entries go, for logging.
     */
    String describe();
}
