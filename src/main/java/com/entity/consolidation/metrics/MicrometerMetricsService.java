package com.entity.consolidation.metrics;

import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.merge.MergeError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code consolidation.candidates.found}: Counter (tag: method)</li>
 *   <li>{@code consolidation.candidates.dropped}: Counter (tag: reason)</li>
 *   <li>{@code consolidation.candidate.confidence}: DistributionSummary</li>
 *   <li>{@code consolidation.merge.completed}: Counter (tags: entityType, method)</li>
 *   <li>{@code consolidation.merge.failed}: Counter (tags: entityType, kind)</li>
 *   <li>{@code consolidation.run.duration}: Timer (tags: entityType, mode)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("consolidation.candidate.confidence")
                .description("Confidence of generated merge candidates")
                .register(registry);
    }

    @Override
    public void recordCandidatesFound(MatchMethod method, int count) {
        counter("found:" + method.name(), "consolidation.candidates.found",
                "Merge candidates produced by a matching pass", "method", method.getCode())
                .increment(count);
    }

    @Override
    public void recordCandidatesDropped(String reason, int count) {
        counter("dropped:" + reason, "consolidation.candidates.dropped",
                "Merge candidates discarded during chain resolution", "reason", reason)
                .increment(count);
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementMergeCompleted(EntityType type, MatchMethod method) {
        String key = "completed:" + type.name() + ":" + method.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("consolidation.merge.completed")
                        .description("Number of entities merged away")
                        .tag("entityType", type.name())
                        .tag("method", method.getCode())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementMergeFailed(EntityType type, MergeError.Kind kind) {
        String key = "failed:" + type.name() + ":" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("consolidation.merge.failed")
                        .description("Number of merges rolled back")
                        .tag("entityType", type.name())
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordRunDuration(EntityType type, boolean dryRun, Duration duration) {
        String mode = dryRun ? "dry-run" : "live";
        Timer timer = timerCache.computeIfAbsent(type.name() + ":" + mode, k ->
                Timer.builder("consolidation.run.duration")
                        .description("Duration of a consolidation run")
                        .tag("entityType", type.name())
                        .tag("mode", mode)
                        .register(registry));
        timer.record(duration);
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
