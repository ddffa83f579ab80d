package com.entity.consolidation.core.model;

import java.util.Objects;

/**
 * A proposed merge of {@code source} into {@code target}.
 * Lives only for the duration of a run; persisted solely through the audit trail.
 *
 * @param editDistance Levenshtein distance for {@link MatchMethod#TYPO_CORRECTION}, 0 otherwise
 */
public record MergeCandidate(
        long sourceId,
        String sourceName,
        int sourceMentions,
        long targetId,
        String targetName,
        int targetMentions,
        double confidence,
        MatchMethod method,
        int editDistance,
        String reason
) {
    public MergeCandidate {
        Objects.requireNonNull(method, "method is required");
        if (sourceId == targetId) {
            throw new IllegalArgumentException("Source and target must differ: " + sourceId);
        }
    }

    /**
     * Copy of this candidate pointing at a different target.
     */
    public MergeCandidate withTarget(Entity target) {
        return withTarget(target.getId(), target.getFullName(), target.getMentions());
    }

    public MergeCandidate withTarget(long id, String name, int mentions) {
        return new MergeCandidate(sourceId, sourceName, sourceMentions,
                id, name, mentions, confidence, method, editDistance, reason);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long sourceId;
        private String sourceName;
        private int sourceMentions;
        private long targetId;
        private String targetName;
        private int targetMentions;
        private double confidence;
        private MatchMethod method;
        private int editDistance;
        private String reason;

        public Builder source(Entity source) {
            this.sourceId = source.getId();
            this.sourceName = source.getFullName();
            this.sourceMentions = source.getMentions();
            return this;
        }

        public Builder target(Entity target) {
            this.targetId = target.getId();
            this.targetName = target.getFullName();
            this.targetMentions = target.getMentions();
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder method(MatchMethod method) {
            this.method = method;
            return this;
        }

        public Builder editDistance(int editDistance) {
            this.editDistance = editDistance;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public MergeCandidate build() {
            return new MergeCandidate(sourceId, sourceName, sourceMentions,
                    targetId, targetName, targetMentions,
                    confidence, method, editDistance, reason);
        }
    }
}
