package com.entity.consolidation.api;

import com.entity.consolidation.audit.AuditEntry;
import com.entity.consolidation.audit.AuditException;
import com.entity.consolidation.audit.AuditLogger;
import com.entity.consolidation.audit.AuditSink;
import com.entity.consolidation.audit.AuditTableSink;
import com.entity.consolidation.audit.JsonFileAuditSink;
import com.entity.consolidation.candidate.CandidateGenerator;
import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MergeCandidate;
import com.entity.consolidation.logging.LogContext;
import com.entity.consolidation.merge.ChainResolver;
import com.entity.consolidation.merge.MergeExecutor;
import com.entity.consolidation.merge.MergeResult;
import com.entity.consolidation.merge.MergeSchema;
import com.entity.consolidation.merge.ResolvedPlan;
import com.entity.consolidation.metrics.MetricsService;
import com.entity.consolidation.metrics.NoOpMetricsService;
import com.entity.consolidation.rules.KnownAliases;
import com.entity.consolidation.store.DatabaseConnection;
import com.entity.consolidation.store.EntityRepository;
import com.entity.consolidation.store.SqliteConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one consolidation pass over a single entity type:
 * load, generate candidates, resolve chains, then (live mode only) merge and audit.
 *
 * <p>Usage:</p>
 * <pre>
 * try (ConsolidationEngine engine = ConsolidationEngine.open(options, metrics)) {
 *     ConsolidationReport report = engine.run();
 * }
 * </pre>
 */
public class ConsolidationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationEngine.class);

    private final ConsolidationOptions options;
    private final DatabaseConnection connection;
    private final EntityRepository repository;
    private final MetricsService metricsService;
    private final Path backupPath;

    public ConsolidationEngine(ConsolidationOptions options, DatabaseConnection connection) {
        this(options, connection, new NoOpMetricsService(), null);
    }

    public ConsolidationEngine(ConsolidationOptions options, DatabaseConnection connection,
                               MetricsService metricsService, Path backupPath) {
        this.options = options;
        this.connection = connection;
        this.repository = new EntityRepository(connection);
        this.metricsService = metricsService;
        this.backupPath = backupPath;
    }

    /**
     * Validates the database file, backs it up for a live run, and opens it
     * (read-only for a dry run).
     *
     * @throws ConsolidationException if the database is missing or cannot be opened, or the backup fails
     */
    public static ConsolidationEngine open(ConsolidationOptions options, MetricsService metricsService) {
        Path db = options.getDbPath();
        if (!Files.isRegularFile(db)) {
            throw new ConsolidationException("Database file not found: " + db);
        }
        Path backup = null;
        if (!options.isDryRun() && options.isBackupEnabled()) {
            backup = new DatabaseBackup(options.getBackupDir()).create(db);
        }
        try {
            DatabaseConnection connection = SqliteConnection.open(db, options.isDryRun());
            return new ConsolidationEngine(options, connection, metricsService, backup);
        } catch (SQLException e) {
            throw new ConsolidationException("Cannot open database " + db + ": " + e.getMessage(), e);
        }
    }

    /**
     * Executes the run.
     *
     * @throws ConsolidationException if the entities or the alias file cannot be loaded
     */
    public ConsolidationReport run() {
        String runId = LogContext.generateCorrelationId();
        EntityType type = options.getEntityType();
        boolean dryRun = options.isDryRun();

        try (LogContext ctx = LogContext.forRun(runId, type.getLabel(), dryRun)) {
            long start = System.nanoTime();
            log.info("consolidation.starting db={} type={} dryRun={} passes={}",
                    connection.getDatabasePath(), type.getLabel(), dryRun, options.getEnabledMethods());

            List<Entity> entities = loadEntities(type);
            CandidateGenerator generator = CandidateGenerator.forMethods(options.getEnabledMethods(),
                    options.getNameVariants(), loadKnownAliases(), options.getTypoWindowSize(), metricsService);
            List<MergeCandidate> candidates = generator.generate(entities);
            ResolvedPlan plan = new ChainResolver(metricsService).resolve(candidates);

            ConsolidationReport.Builder report = ConsolidationReport.builder()
                    .runId(runId)
                    .entityType(type)
                    .dryRun(dryRun)
                    .entitiesBefore(entities.size())
                    .candidatesFound(candidates.size())
                    .plan(plan.accepted())
                    .skippedAlreadyRedirected(plan.skippedAlreadyRedirected())
                    .skippedCircular(plan.skippedCircular())
                    .backupPath(backupPath);

            if (dryRun) {
                logPlan(plan);
                report.entitiesAfter(entities.size() - plan.size());
            } else {
                executePlan(plan, report);
                report.entitiesAfter(countEntities(type));
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordRunDuration(type, dryRun, elapsed);
            ConsolidationReport result = report.elapsed(elapsed).build();
            log.info("consolidation.completed type={} dryRun={} before={} after={} candidates={} planned={} "
                            + "merged={} failed={} mentionsTransferred={} elapsedMs={}",
                    type.getLabel(), dryRun, result.entitiesBefore(), result.entitiesAfter(),
                    result.candidatesFound(), result.plan().size(), result.mergesSucceeded(),
                    result.mergesFailed(), result.mentionsTransferred(), elapsed.toMillis());
            return result;
        }
    }

    private void executePlan(ResolvedPlan plan, ConsolidationReport.Builder report) {
        List<AuditSink> sinks = new ArrayList<>();
        sinks.add(new JsonFileAuditSink(options.getAuditPath()));
        if (options.isAuditTable()) {
            sinks.add(new AuditTableSink(connection, options.getAuditUserId()));
        }
        AuditLogger auditLogger = new AuditLogger(sinks, options.getCheckpointInterval());
        MergeExecutor executor = new MergeExecutor(connection, repository, MergeSchema.defaults(),
                auditLogger, metricsService);

        int succeeded = 0;
        int mentions = 0;
        List<ConsolidationReport.FailedMerge> failures = new ArrayList<>();
        int index = 0;
        for (MergeCandidate candidate : plan.accepted()) {
            index++;
            MergeResult<AuditEntry> result = executor.execute(candidate);
            if (result.isSuccess()) {
                succeeded++;
                mentions += result.value().mentionsTransferred();
            } else {
                failures.add(new ConsolidationReport.FailedMerge(candidate, result.error()));
            }
            if (index % 100 == 0) {
                log.info("consolidation.progress done={} total={} failed={}", index, plan.size(), failures.size());
            }
        }

        report.mergesSucceeded(succeeded)
                .failures(failures)
                .mentionsTransferred(mentions)
                .auditPath(options.getAuditPath());
        try {
            auditLogger.flush();
            log.info("audit.written entries={} path={}", auditLogger.size(), options.getAuditPath());
        } catch (AuditException e) {
            log.error("audit.failed entries={} error={}", auditLogger.size(), e.getMessage(), e);
            report.auditError(e.getMessage());
        }
    }

    private void logPlan(ResolvedPlan plan) {
        log.info("dry-run: {} merge(s) planned, no changes written", plan.size());
        for (MergeCandidate c : plan.accepted()) {
            log.info("plan source={} '{}' ({}) -> target={} '{}' ({}) confidence={} method={} reason={}",
                    c.sourceId(), c.sourceName(), c.sourceMentions(), c.targetId(), c.targetName(),
                    c.targetMentions(), c.confidence(), c.method().getCode(), c.reason());
        }
    }

    private List<Entity> loadEntities(EntityType type) {
        try {
            return repository.findByType(type);
        } catch (SQLException e) {
            throw new ConsolidationException("Failed to load " + type.getLabel() + " entities: " + e.getMessage(), e);
        }
    }

    private KnownAliases loadKnownAliases() {
        Path file = options.getKnownAliasesPath();
        if (file == null) {
            return KnownAliases.empty();
        }
        try {
            KnownAliases aliases = KnownAliases.load(file);
            log.info("Known aliases loaded file={} canonicalNames={}", file, aliases.size());
            return aliases;
        } catch (IOException e) {
            throw new ConsolidationException("Cannot read alias file " + file + ": " + e.getMessage(), e);
        }
    }

    private int countEntities(EntityType type) {
        try {
            return repository.countByType(type);
        } catch (SQLException e) {
            throw new ConsolidationException("Failed to count " + type.getLabel() + " entities: " + e.getMessage(), e);
        }
    }

    public ConsolidationOptions getOptions() {
        return options;
    }

    public Path getBackupPath() {
        return backupPath;
    }

    @Override
    public void close() {
        connection.close();
    }
}
