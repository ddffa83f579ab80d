package com.entity.consolidation.cli;

import com.entity.consolidation.api.ConsolidationEngine;
import com.entity.consolidation.api.ConsolidationException;
import com.entity.consolidation.api.ConsolidationOptions;
import com.entity.consolidation.api.ConsolidationReport;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <p>Exit codes: 0 when the run completed (individual merge failures are reported, not fatal),
 * 1 on a fatal startup error, 2 on a usage error.</p>
 */
public final class ConsolidationCommand {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: entity-consolidation --db <path> [options]

              --db <path>           SQLite database file (env ENTITY_DB_PATH)
              --type <type>         Person, Organization or Unknown (default Person)
              --dry-run             preview the merge plan without writing anything
              --audit <path>        audit JSON file (env CONSOLIDATION_AUDIT_PATH,
                                    default entity_consolidation_audit.json)
              --audit-table         also record merges in the audit_log table
              --backup-dir <dir>    backup directory (env CONSOLIDATION_BACKUP_DIR, default backups)
              --no-backup           skip the pre-run backup
              --passes <list>       comma-separated: known,exact,reordering,typo,prefix,nickname
                                    (default exact,reordering,typo)
              --aliases <path>      JSON file of canonical names and their variants (enables known)
              --checkpoint <n>      flush the audit every n merges, 0 to disable (default 100)
              --typo-window <n>     neighbours compared per name in the typo pass (default 20)
              --help                show this message
            """;

    private final PrintStream out;
    private final PrintStream err;

    ConsolidationCommand(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new ConsolidationCommand(System.out, System.err).execute(args, System.getenv());
        System.exit(code);
    }

    int execute(String[] args, Map<String, String> env) {
        if (Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h")) {
            out.print(USAGE);
            return EXIT_OK;
        }

        ConsolidationOptions options;
        try {
            options = ConsolidationOptions.fromArgs(args, env);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (ConsolidationEngine engine = ConsolidationEngine.open(options, new MicrometerMetricsService(registry))) {
            ConsolidationReport report = engine.run();
            printSummary(report);
            logMetrics(registry);
            return EXIT_OK;
        } catch (ConsolidationException e) {
            log.error("consolidation.aborted error={}", e.getMessage(), e);
            err.println("Fatal: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    private void printSummary(ConsolidationReport report) {
        out.println();
        out.println(report.dryRun() ? "CONSOLIDATION PREVIEW (dry run, nothing written)" : "CONSOLIDATION SUMMARY");
        out.printf("  Entity type:            %s%n", report.entityType().getLabel());
        out.printf("  Entities before:        %d%n", report.entitiesBefore());
        out.printf("  Entities after:         %d%n", report.entitiesAfter());
        out.printf("  Candidates found:       %d%n", report.candidatesFound());
        out.printf("  Skipped (redirected):   %d%n", report.skippedAlreadyRedirected());
        out.printf("  Skipped (circular):     %d%n", report.skippedCircular());
        out.printf("  Merges planned:         %d%n", report.plan().size());
        for (Map.Entry<MatchMethod, Integer> e : report.planByMethod().entrySet()) {
            out.printf("    %-22s%d%n", e.getKey().getCode() + ":", e.getValue());
        }
        if (!report.dryRun()) {
            out.printf("  Merges completed:       %d%n", report.mergesSucceeded());
            out.printf("  Merges failed:          %d%n", report.mergesFailed());
            out.printf("  Mentions transferred:   %d%n", report.mentionsTransferred());
            if (report.backupPath() != null) {
                out.printf("  Backup:                 %s%n", report.backupPath());
            }
            out.printf("  Audit file:             %s%n", report.auditPath());
        }
        for (ConsolidationReport.FailedMerge failure : report.failures()) {
            out.printf("  FAILED %d -> %d: %s %s%n", failure.candidate().sourceId(),
                    failure.candidate().targetId(), failure.error().kind(), failure.error().message());
        }
        if (report.auditError() != null) {
            out.println("  AUDIT NOT WRITTEN: " + report.auditError());
        }
        out.printf("  Elapsed:                %d ms%n", report.elapsed().toMillis());
    }

    private static void logMetrics(SimpleMeterRegistry registry) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (Meter meter : registry.getMeters()) {
            for (Measurement measurement : meter.measure()) {
                log.debug("metric name={} tags={} statistic={} value={}", meter.getId().getName(),
                        meter.getId().getTags(), measurement.getStatistic(), measurement.getValue());
            }
        }
    }
}
