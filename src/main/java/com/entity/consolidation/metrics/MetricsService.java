package com.entity.consolidation.metrics;

import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.merge.MergeError;

import java.time.Duration;

/**
 * Interface for recording consolidation metrics.
 * The default {@link NoOpMetricsService} does nothing; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordCandidatesFound(MatchMethod method, int count);

    void recordCandidatesDropped(String reason, int count);

    void recordConfidence(double confidence);

    void incrementMergeCompleted(EntityType type, MatchMethod method);

    void incrementMergeFailed(EntityType type, MergeError.Kind kind);

    void recordRunDuration(EntityType type, boolean dryRun, Duration duration);
}
