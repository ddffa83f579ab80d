package com.entity.consolidation.merge;

import com.entity.consolidation.store.DatabaseConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * One database transaction per merge.
 * Every step runs inside the transaction; unless {@link #commit()} is reached,
 * {@link #close()} rolls the whole merge back.
 *
 * <p>Usage:</p>
 * <pre>
 * try (MergeTransaction tx = MergeTransaction.begin(connection)) {
 *     tx.execute("repoint media_items", () -> repoint(...));
 *     tx.execute("delete source entity", () -> delete(...));
 *     tx.commit();
 * }
 * // If commit() was not reached, every step is rolled back
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final DatabaseConnection connection;
    private int steps = 0;
    private boolean committed = false;
    private boolean closed = false;

    private MergeTransaction(DatabaseConnection connection) {
        this.connection = connection;
    }

    /**
     * Opens a transaction on the connection.
     */
    public static MergeTransaction begin(DatabaseConnection connection) throws SQLException {
        connection.beginTransaction();
        return new MergeTransaction(connection);
    }

    /**
     * Runs a step inside the transaction.
     *
     * @param description human-readable description of the step
     * @return the step's result
     * @throws SQLException if the step fails; the transaction is left for {@link #close()} to roll back
     */
    public <T> T execute(String description, Step<T> step) throws SQLException {
        if (closed || committed) {
            throw new IllegalStateException("Transaction is already finished");
        }
        log.debug("Executing merge step: {}", description);
        try {
            T result = step.run();
            steps++;
            return result;
        } catch (SQLException e) {
            log.warn("Merge step '{}' failed: {}", description, e.getMessage());
            throw e;
        }
    }

    /**
     * Commits every step executed so far.
     */
    public void commit() throws SQLException {
        if (closed || committed) {
            throw new IllegalStateException("Transaction is already finished");
        }
        connection.commit();
        committed = true;
        log.debug("Merge transaction committed steps={}", steps);
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!committed) {
            log.warn("MergeTransaction closed without commit - rolling back {} step(s)", steps);
            try {
                connection.rollback();
            } catch (SQLException e) {
                log.error("Rollback failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * A unit of work inside the transaction.
     */
    @FunctionalInterface
    public interface Step<T> {
        T run() throws SQLException;
    }
}
