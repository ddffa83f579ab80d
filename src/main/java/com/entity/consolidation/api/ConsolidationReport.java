package com.entity.consolidation.api;

import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.core.model.MergeCandidate;
import com.entity.consolidation.merge.MergeError;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one consolidation run.
 *
 * @param plan       merges in execution order (for a dry run, the merges that would have run)
 * @param backupPath backup written before the run, or {@code null}
 * @param auditPath  audit file written by the run, or {@code null} for a dry run
 * @param auditError why the audit could not be written, or {@code null}
 */
public record ConsolidationReport(
        String runId,
        EntityType entityType,
        boolean dryRun,
        int entitiesBefore,
        int entitiesAfter,
        int candidatesFound,
        List<MergeCandidate> plan,
        int skippedAlreadyRedirected,
        int skippedCircular,
        int mergesSucceeded,
        List<FailedMerge> failures,
        int mentionsTransferred,
        Path backupPath,
        Path auditPath,
        String auditError,
        Duration elapsed
) {
    /**
     * A merge that was rolled back.
     */
    public record FailedMerge(MergeCandidate candidate, MergeError error) {}

    public ConsolidationReport {
        plan = plan != null ? List.copyOf(plan) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int mergesFailed() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty() || auditError != null;
    }

    /**
     * Planned merges per match method, in declaration order.
     */
    public Map<MatchMethod, Integer> planByMethod() {
        Map<MatchMethod, Integer> counts = new EnumMap<>(MatchMethod.class);
        for (MergeCandidate c : plan) {
            counts.merge(c.method(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        return "ConsolidationReport{" +
                "type=" + entityType.getLabel() +
                ", dryRun=" + dryRun +
                ", before=" + entitiesBefore +
                ", after=" + entitiesAfter +
                ", candidates=" + candidatesFound +
                ", planned=" + plan.size() +
                ", merged=" + mergesSucceeded +
                ", failed=" + failures.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String runId;
        private EntityType entityType = EntityType.UNKNOWN;
        private boolean dryRun;
        private int entitiesBefore;
        private int entitiesAfter;
        private int candidatesFound;
        private List<MergeCandidate> plan;
        private int skippedAlreadyRedirected;
        private int skippedCircular;
        private int mergesSucceeded;
        private List<FailedMerge> failures;
        private int mentionsTransferred;
        private Path backupPath;
        private Path auditPath;
        private String auditError;
        private Duration elapsed = Duration.ZERO;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder entitiesBefore(int entitiesBefore) {
            this.entitiesBefore = entitiesBefore;
            return this;
        }

        public Builder entitiesAfter(int entitiesAfter) {
            this.entitiesAfter = entitiesAfter;
            return this;
        }

        public Builder candidatesFound(int candidatesFound) {
            this.candidatesFound = candidatesFound;
            return this;
        }

        public Builder plan(List<MergeCandidate> plan) {
            this.plan = plan;
            return this;
        }

        public Builder skippedAlreadyRedirected(int skippedAlreadyRedirected) {
            this.skippedAlreadyRedirected = skippedAlreadyRedirected;
            return this;
        }

        public Builder skippedCircular(int skippedCircular) {
            this.skippedCircular = skippedCircular;
            return this;
        }

        public Builder mergesSucceeded(int mergesSucceeded) {
            this.mergesSucceeded = mergesSucceeded;
            return this;
        }

        public Builder failures(List<FailedMerge> failures) {
            this.failures = failures;
            return this;
        }

        public Builder mentionsTransferred(int mentionsTransferred) {
            this.mentionsTransferred = mentionsTransferred;
            return this;
        }

        public Builder backupPath(Path backupPath) {
            this.backupPath = backupPath;
            return this;
        }

        public Builder auditPath(Path auditPath) {
            this.auditPath = auditPath;
            return this;
        }

        public Builder auditError(String auditError) {
            this.auditError = auditError;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public ConsolidationReport build() {
            return new ConsolidationReport(runId, entityType, dryRun, entitiesBefore, entitiesAfter,
                    candidatesFound, plan, skippedAlreadyRedirected, skippedCircular, mergesSucceeded,
                    failures, mentionsTransferred, backupPath, auditPath, auditError, elapsed);
        }
    }
}
