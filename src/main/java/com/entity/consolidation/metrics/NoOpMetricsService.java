package com.entity.consolidation.metrics;

import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.merge.MergeError;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCandidatesFound(MatchMethod method, int count) {
    }

    @Override
    public void recordCandidatesDropped(String reason, int count) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void incrementMergeCompleted(EntityType type, MatchMethod method) {
    }

    @Override
    public void incrementMergeFailed(EntityType type, MergeError.Kind kind) {
    }

    @Override
    public void recordRunDuration(EntityType type, boolean dryRun, Duration duration) {
    }
}
