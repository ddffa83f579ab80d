package com.entity.consolidation.audit;

import com.entity.consolidation.core.model.MergeCandidate;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one completed merge.
 *
 * @param method audit code of the match method, e.g. {@code exact_match}
 */
public record AuditEntry(
        Instant timestamp,
        long sourceId,
        String sourceName,
        long targetId,
        String targetName,
        int mentionsTransferred,
        double confidence,
        String method
) {
    public AuditEntry {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(method, "method is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant timestamp = Instant.now();
        private long sourceId;
        private String sourceName;
        private long targetId;
        private String targetName;
        private int mentionsTransferred;
        private double confidence;
        private String method;

        /**
         * Copies ids, names, confidence and method from the executed candidate.
         */
        public Builder candidate(MergeCandidate candidate) {
            this.sourceId = candidate.sourceId();
            this.sourceName = candidate.sourceName();
            this.targetId = candidate.targetId();
            this.targetName = candidate.targetName();
            this.confidence = candidate.confidence();
            this.method = candidate.method().getCode();
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceId(long sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder targetId(long targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder mentionsTransferred(int mentionsTransferred) {
            this.mentionsTransferred = mentionsTransferred;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(timestamp, sourceId, sourceName, targetId, targetName,
                    mentionsTransferred, confidence, method);
        }
    }
}
