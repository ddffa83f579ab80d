package com.entity.consolidation.merge;

import com.entity.consolidation.core.model.MergeCandidate;
import com.entity.consolidation.metrics.MetricsService;
import com.entity.consolidation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns overlapping candidates into a plan that is safe to execute in order.
 *
 * <p>Candidates are visited by confidence, highest first; equal confidence keeps discovery
 * order. A source that already points somewhere is skipped, and a candidate whose target
 * resolves back to its source is dropped as circular. Accepted candidates are finally
 * re-pointed at the root of their tree, so a chain X→Y, Y→Z executes as X→Z, Y→Z.</p>
 */
public class ChainResolver {
    private static final Logger log = LoggerFactory.getLogger(ChainResolver.class);

    static final String DROP_ALREADY_REDIRECTED = "already_redirected";
    static final String DROP_CIRCULAR = "circular";

    private final MetricsService metricsService;

    public ChainResolver() {
        this(new NoOpMetricsService());
    }

    public ChainResolver(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    public ResolvedPlan resolve(List<MergeCandidate> candidates) {
        List<MergeCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble(MergeCandidate::confidence).reversed());

        Map<Long, EntityRef> refs = new HashMap<>();
        for (MergeCandidate c : ordered) {
            refs.putIfAbsent(c.sourceId(), new EntityRef(c.sourceName(), c.sourceMentions()));
            refs.putIfAbsent(c.targetId(), new EntityRef(c.targetName(), c.targetMentions()));
        }

        DisjointSet forest = new DisjointSet();
        List<MergeCandidate> accepted = new ArrayList<>();
        int alreadyRedirected = 0;
        int circular = 0;

        for (MergeCandidate c : ordered) {
            if (forest.isRedirected(c.sourceId())) {
                alreadyRedirected++;
                log.info("chain.skipped source={} '{}' reason=already merged into {}",
                        c.sourceId(), c.sourceName(), forest.find(c.sourceId()));
                continue;
            }
            long targetRoot = forest.find(c.targetId());
            if (targetRoot == c.sourceId()) {
                circular++;
                log.info("chain.dropped source={} target={} reason=circular", c.sourceId(), c.targetId());
                continue;
            }
            forest.attach(c.sourceId(), targetRoot);
            accepted.add(c);
        }

        List<MergeCandidate> plan = new ArrayList<>(accepted.size());
        for (MergeCandidate c : accepted) {
            long root = forest.find(c.sourceId());
            if (root == c.targetId()) {
                plan.add(c);
            } else {
                EntityRef ref = refs.get(root);
                log.debug("chain.collapsed source={} from={} to={}", c.sourceId(), c.targetId(), root);
                plan.add(c.withTarget(root, ref.name(), ref.mentions()));
            }
        }

        metricsService.recordCandidatesDropped(DROP_ALREADY_REDIRECTED, alreadyRedirected);
        metricsService.recordCandidatesDropped(DROP_CIRCULAR, circular);
        log.info("chain.resolved candidates={} accepted={} alreadyRedirected={} circular={}",
                candidates.size(), plan.size(), alreadyRedirected, circular);
        return new ResolvedPlan(plan, alreadyRedirected, circular);
    }

    private record EntityRef(String name, int mentions) {}
}
