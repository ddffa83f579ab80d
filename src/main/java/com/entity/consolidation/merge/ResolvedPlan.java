package com.entity.consolidation.merge;

import com.entity.consolidation.core.model.MergeCandidate;

import java.util.List;

/**
 * Output of {@link ChainResolver}: the merges to execute, in priority order.
 * Every accepted candidate targets an entity that is not itself merged away in the same run.
 *
 * @param skippedAlreadyRedirected candidates whose source was already claimed by a stronger match
 * @param skippedCircular          candidates that would have closed a cycle
 */
public record ResolvedPlan(List<MergeCandidate> accepted, int skippedAlreadyRedirected, int skippedCircular) {

    public ResolvedPlan {
        accepted = accepted != null ? List.copyOf(accepted) : List.of();
    }

    public int size() {
        return accepted.size();
    }

    public boolean isEmpty() {
        return accepted.isEmpty();
    }
}
