package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.core.model.MergeCandidate;
import com.entity.consolidation.metrics.MetricsService;
import com.entity.consolidation.metrics.NoOpMetricsService;
import com.entity.consolidation.rules.KnownAliases;
import com.entity.consolidation.rules.NameVariants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Runs the enabled matching passes over one entity type and returns the deduplicated
 * candidates in discovery order. Passes run in {@link MatchMethod} declaration order,
 * so when two passes find the same pair the earlier (higher-confidence) one keeps it.
 */
public class CandidateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private final List<CandidatePass> passes;
    private final MetricsService metricsService;

    public CandidateGenerator(List<CandidatePass> passes) {
        this(passes, new NoOpMetricsService());
    }

    public CandidateGenerator(List<CandidatePass> passes, MetricsService metricsService) {
        if (passes == null || passes.isEmpty()) {
            throw new IllegalArgumentException("At least one matching pass is required");
        }
        this.passes = List.copyOf(passes);
        this.metricsService = metricsService;
    }

    /**
     * Builds a generator for the given methods, without curated aliases.
     */
    public static CandidateGenerator forMethods(Set<MatchMethod> methods, NameVariants nameVariants,
                                                int typoWindowSize, MetricsService metricsService) {
        return forMethods(methods, nameVariants, KnownAliases.empty(), typoWindowSize, metricsService);
    }

    /**
     * Builds a generator for the given methods.
     */
    public static CandidateGenerator forMethods(Set<MatchMethod> methods, NameVariants nameVariants,
                                                KnownAliases knownAliases, int typoWindowSize,
                                                MetricsService metricsService) {
        List<CandidatePass> passes = new ArrayList<>();
        for (MatchMethod method : MatchMethod.values()) {
            if (!methods.contains(method)) {
                continue;
            }
            passes.add(switch (method) {
                case EXACT_MATCH -> new ExactMatchPass();
                case KNOWN_ALIAS -> new KnownAliasPass(knownAliases);
                case NAME_REORDERING -> new ReorderingPass();
                case TYPO_CORRECTION -> new TypoPass(nameVariants, typoWindowSize);
                case PREFIX_STRIPPING -> new PrefixStrippingPass(nameVariants);
                case NICKNAME_RESOLUTION -> new NicknamePass(nameVariants);
            });
        }
        return new CandidateGenerator(passes, metricsService);
    }

    public List<CandidatePass> getPasses() {
        return passes;
    }

    /**
     * Finds merge candidates among the given entities.
     */
    public List<MergeCandidate> generate(List<Entity> entities) {
        log.info("candidates.starting entities={} passes={}", entities.size(), passes.size());
        CandidateCollector collector = new CandidateCollector();

        for (CandidatePass pass : passes) {
            int before = collector.size();
            long start = System.nanoTime();
            pass.findCandidates(entities, collector);
            int found = collector.size() - before;
            metricsService.recordCandidatesFound(pass.method(), found);
            log.info("candidates.pass.completed method={} found={} elapsedMs={}",
                    pass.method().getCode(), found, (System.nanoTime() - start) / 1_000_000);
        }

        List<MergeCandidate> candidates = collector.getCandidates();
        for (MergeCandidate c : candidates) {
            metricsService.recordConfidence(c.confidence());
        }
        if (log.isDebugEnabled()) {
            for (MergeCandidate c : candidates) {
                log.debug("candidate confidence={} source={} '{}' ({}) target={} '{}' ({}) reason={}",
                        c.confidence(), c.sourceId(), c.sourceName(), c.sourceMentions(),
                        c.targetId(), c.targetName(), c.targetMentions(), c.reason());
            }
        }
        log.info("candidates.completed total={}", candidates.size());
        return candidates;
    }
}
