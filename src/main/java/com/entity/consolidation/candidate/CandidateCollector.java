package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.core.model.MergeCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates candidates across all matching passes of one run.
 *
 * <p>{@link #offer} orients a pair so the target is the entity that ranks first under
 * {@link #CANONICAL_FIRST}: more mentions wins, equal mentions fall back to the lower id.
 * Passes that know which side is canonical use {@link #offerDirected} instead.
 * One dedup set keyed by the pair spans all passes, so a pair found by several passes is
 * kept only from the first one, in the direction that pass gave it.</p>
 */
public class CandidateCollector {

    /**
     * Orders entities from most to least canonical.
     */
    public static final Comparator<Entity> CANONICAL_FIRST = Comparator
            .comparingInt(Entity::getMentions).reversed()
            .thenComparingLong(Entity::getId);

    private final List<MergeCandidate> candidates = new ArrayList<>();
    private final Set<PairKey> seen = new HashSet<>();

    /**
     * Offers a matched pair. Returns false if it is a self-pair or was already collected.
     */
    public boolean offer(Entity a, Entity b, MatchMethod method, int editDistance, String reason) {
        if (a.getId() == b.getId()) {
            return false;
        }
        boolean aIsTarget = CANONICAL_FIRST.compare(a, b) <= 0;
        return offerDirected(aIsTarget ? b : a, aIsTarget ? a : b, method, editDistance, reason);
    }

    /**
     * Offers a pair whose direction is already decided: {@code source} merges into {@code target}.
     */
    public boolean offerDirected(Entity source, Entity target, MatchMethod method, int editDistance, String reason) {
        if (source.getId() == target.getId()) {
            return false;
        }
        if (!seen.add(PairKey.of(source.getId(), target.getId()))) {
            return false;
        }

        candidates.add(MergeCandidate.builder()
                .source(source)
                .target(target)
                .method(method)
                .editDistance(editDistance)
                .confidence(ConfidenceScorer.score(method, editDistance))
                .reason(reason)
                .build());
        return true;
    }

    public boolean offer(Entity a, Entity b, MatchMethod method, String reason) {
        return offer(a, b, method, 0, reason);
    }

    public int size() {
        return candidates.size();
    }

    /**
     * Candidates in discovery order (unmodifiable).
     */
    public List<MergeCandidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    /** Unordered, so a pair claimed by one pass cannot come back reversed from another. */
    private record PairKey(long low, long high) {
        static PairKey of(long a, long b) {
            return new PairKey(Math.min(a, b), Math.max(a, b));
        }
    }
}
