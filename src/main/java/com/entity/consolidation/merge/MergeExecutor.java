package com.entity.consolidation.merge;

import com.entity.consolidation.audit.AuditEntry;
import com.entity.consolidation.audit.AuditLogger;
import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MergeCandidate;
import com.entity.consolidation.logging.LogContext;
import com.entity.consolidation.metrics.MetricsService;
import com.entity.consolidation.metrics.NoOpMetricsService;
import com.entity.consolidation.store.DatabaseConnection;
import com.entity.consolidation.store.EntityRepository;
import com.entity.consolidation.store.SqlErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies one merge candidate as a single transaction.
 *
 * <p>Merge steps:</p>
 * <ol>
 *   <li>Repoint every entity reference from source to target; rows that would duplicate
 *       an existing target row are deleted instead</li>
 *   <li>Merge the person subtype rows and their dependents</li>
 *   <li>Repoint relationship pairs and drop the self-loops this creates</li>
 *   <li>Fold the source name and aliases into the target's aliases</li>
 *   <li>Add the source's mentions to the target</li>
 *   <li>Delete the source entity</li>
 *   <li>Record the audit entry once the transaction has committed</li>
 * </ol>
 *
 * <p>Any failure rolls back this merge only and is returned as a {@link MergeError}.</p>
 */
public class MergeExecutor {
    private static final Logger log = LoggerFactory.getLogger(MergeExecutor.class);

    private final DatabaseConnection connection;
    private final EntityRepository repository;
    private final MergeSchema schema;
    private final AuditLogger auditLogger;
    private final MetricsService metricsService;

    public MergeExecutor(DatabaseConnection connection, AuditLogger auditLogger) {
        this(connection, new EntityRepository(connection), MergeSchema.defaults(), auditLogger,
                new NoOpMetricsService());
    }

    public MergeExecutor(DatabaseConnection connection, EntityRepository repository, MergeSchema schema,
                         AuditLogger auditLogger, MetricsService metricsService) {
        if (connection.isReadOnly()) {
            throw new IllegalArgumentException("MergeExecutor requires a writable connection");
        }
        this.connection = connection;
        this.repository = repository;
        this.schema = schema;
        this.auditLogger = auditLogger;
        this.metricsService = metricsService;
    }

    /**
     * Merges {@code candidate.sourceId} into {@code candidate.targetId}.
     *
     * @return the audit entry of the merge, or why it failed
     */
    public MergeResult<AuditEntry> execute(MergeCandidate candidate) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forMerge(correlationId, candidate.sourceId(), candidate.targetId())) {
            long start = System.nanoTime();
            Attempt attempt = new Attempt();
            MergeResult<AuditEntry> result = executeInTransaction(candidate, attempt);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            if (result.isSuccess()) {
                AuditEntry entry = auditLogger.append(result.value());
                metricsService.incrementMergeCompleted(attempt.type, candidate.method());
                log.info("merge.completed sourceEntityId={} sourceName='{}' targetEntityId={} targetName='{}' "
                                + "mentions={} confidence={} method={} elapsedMs={}",
                        entry.sourceId(), entry.sourceName(), entry.targetId(), entry.targetName(),
                        entry.mentionsTransferred(), entry.confidence(), entry.method(), elapsedMs);
            } else {
                MergeError error = result.error();
                metricsService.incrementMergeFailed(attempt.type, error.kind());
                log.warn("merge.failed sourceEntityId={} targetEntityId={} kind={} code={} message={}",
                        candidate.sourceId(), candidate.targetId(), error.kind(), error.code(), error.message());
            }
            return result;
        }
    }

    private MergeResult<AuditEntry> executeInTransaction(MergeCandidate candidate, Attempt attempt) {
        try (MergeTransaction tx = MergeTransaction.begin(connection)) {
            Optional<Entity> maybeSource = tx.execute("load source", () -> repository.findById(candidate.sourceId()));
            Optional<Entity> maybeTarget = tx.execute("load target", () -> repository.findById(candidate.targetId()));
            if (maybeSource.isEmpty() || maybeTarget.isEmpty()) {
                long missing = maybeSource.isEmpty() ? candidate.sourceId() : candidate.targetId();
                return MergeResult.failure(MergeError.notFound("Entity " + missing + " no longer exists"));
            }
            Entity source = maybeSource.get();
            Entity target = maybeTarget.get();
            attempt.type = source.getType();
            long from = source.getId();
            long to = target.getId();

            for (MergeSchema.Reference reference : schema.getEntityReferences()) {
                tx.execute("repoint " + reference.table() + "." + reference.column(),
                        () -> repoint(reference, from, to));
            }
            for (MergeSchema.Subtype subtype : schema.getSubtypes()) {
                tx.execute("merge " + subtype.table(), () -> mergeSubtype(subtype, from, to));
            }
            for (MergeSchema.PairReference pair : schema.getPairReferences()) {
                tx.execute("repoint " + pair.table(), () -> repointPair(pair, from, to));
            }
            if (repository.supportsAliases()) {
                tx.execute("merge aliases", () -> mergeAliases(source, target));
            }
            tx.execute("transfer mentions", () -> repository.addMentions(to, source.getMentions()));
            tx.execute("delete source entity", () -> repository.delete(from));
            tx.commit();

            return MergeResult.success(AuditEntry.builder()
                    .candidate(candidate)
                    .sourceName(source.getFullName())
                    .targetName(target.getFullName())
                    .mentionsTransferred(source.getMentions())
                    .build());
        } catch (SQLException e) {
            return MergeResult.failure(SqlErrors.classify(e));
        } catch (RuntimeException e) {
            log.error("Unexpected merge error", e);
            return MergeResult.failure(MergeError.other(e.getClass().getSimpleName(), e.getMessage()));
        }
    }

    /**
     * Moves rows of one reference column from {@code from} to {@code to}.
     *
     * @return rows moved
     */
    int repoint(MergeSchema.Reference reference, long from, long to) throws SQLException {
        String table = reference.table();
        String column = reference.column();
        if (!connection.columnExists(table, column)) {
            log.debug("Skipping {}.{}: not present", table, column);
            return 0;
        }
        if (reference.isComposite() && connection.columnExists(table, reference.uniqueKey())) {
            return repointComposite(table, column, reference.uniqueKey(), from, to);
        }
        return updateOrDelete(table, column, column + " = ?", to, from);
    }

    private int repointComposite(String table, String column, String key, long from, long to) throws SQLException {
        List<Map<String, Object>> rows = connection.query(
                "SELECT DISTINCT " + key + " AS k FROM " + table + " WHERE " + column + " = ?", from);
        int moved = 0;
        for (Map<String, Object> row : rows) {
            moved += updateOrDelete(table, column, column + " = ? AND " + key + " IS ?", to, from, row.get("k"));
        }
        return moved;
    }

    /**
     * Sets {@code column} to {@code to} on the rows matching {@code where}. When that would
     * duplicate a row the target already owns, the matching rows are deleted instead.
     * Any other failure propagates and aborts the merge.
     *
     * @return rows moved
     */
    private int updateOrDelete(String table, String column, String where, long to, Object... whereParams)
            throws SQLException {
        Object[] params = new Object[whereParams.length + 1];
        params[0] = to;
        System.arraycopy(whereParams, 0, params, 1, whereParams.length);
        try {
            return connection.update("UPDATE " + table + " SET " + column + " = ? WHERE " + where, params);
        } catch (SQLException e) {
            if (!SqlErrors.isUniqueViolation(e)) {
                throw e;
            }
            int deleted = connection.update("DELETE FROM " + table + " WHERE " + where, whereParams);
            log.debug("{}.{} already held by target, deleted {} source row(s)", table, column, deleted);
            return 0;
        }
    }

    private int mergeSubtype(MergeSchema.Subtype subtype, long from, long to) throws SQLException {
        String table = subtype.table();
        if (!connection.columnExists(table, subtype.entityColumn())) {
            log.debug("Skipping {}: not present", table);
            return 0;
        }
        String select = "SELECT " + subtype.idColumn() + " AS sid FROM " + table
                + " WHERE " + subtype.entityColumn() + " = ? ORDER BY " + subtype.idColumn();
        List<Map<String, Object>> sourceRows = connection.query(select, from);
        if (sourceRows.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> targetRows = connection.query(select, to);
        if (targetRows.isEmpty()) {
            return connection.update("UPDATE " + table + " SET " + subtype.entityColumn() + " = ? WHERE "
                    + subtype.entityColumn() + " = ?", to, from);
        }

        long targetSubtypeId = ((Number) targetRows.get(0).get("sid")).longValue();
        for (Map<String, Object> row : sourceRows) {
            long sourceSubtypeId = ((Number) row.get("sid")).longValue();
            for (MergeSchema.Reference reference : subtype.references()) {
                repoint(reference, sourceSubtypeId, targetSubtypeId);
            }
            connection.update("DELETE FROM " + table + " WHERE " + subtype.idColumn() + " = ?", sourceSubtypeId);
            log.debug("{} {} merged into {}", table, sourceSubtypeId, targetSubtypeId);
        }
        return sourceRows.size();
    }

    private int repointPair(MergeSchema.PairReference pair, long from, long to) throws SQLException {
        String table = pair.table();
        if (!connection.columnExists(table, pair.firstColumn()) || !connection.columnExists(table, pair.secondColumn())) {
            log.debug("Skipping {}({}, {}): not present", table, pair.firstColumn(), pair.secondColumn());
            return 0;
        }
        int moved = 0;
        for (String column : List.of(pair.firstColumn(), pair.secondColumn())) {
            // row by row, so one clashing relationship does not hold back the others
            List<Map<String, Object>> rows = connection.query(
                    "SELECT rowid AS rid FROM " + table + " WHERE " + column + " = ?", from);
            for (Map<String, Object> row : rows) {
                moved += updateOrDelete(table, column, "rowid = ?", to, row.get("rid"));
            }
        }
        int loops = connection.update("DELETE FROM " + table + " WHERE "
                + pair.firstColumn() + " = ? AND " + pair.secondColumn() + " = ?", to, to);
        if (loops > 0) {
            log.debug("{}: removed {} self-referencing row(s)", table, loops);
        }
        return moved;
    }

    private int mergeAliases(Entity source, Entity target) throws SQLException {
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        seen.add(target.getFullName());
        Set<String> merged = new LinkedHashSet<>();
        for (String alias : target.getAliases()) {
            if (seen.add(alias)) {
                merged.add(alias);
            }
        }
        int before = merged.size();
        if (seen.add(source.getFullName())) {
            merged.add(source.getFullName());
        }
        for (String alias : source.getAliases()) {
            if (seen.add(alias)) {
                merged.add(alias);
            }
        }
        if (merged.size() == before && merged.size() == target.getAliases().size()) {
            return 0;
        }
        repository.updateAliases(target.getId(), merged);
        return merged.size() - before;
    }

    private static final class Attempt {
        EntityType type = EntityType.UNKNOWN;
    }
}
