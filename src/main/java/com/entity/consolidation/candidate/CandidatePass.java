package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;

import java.util.List;

/**
 * One duplicate-detection strategy over the full entity list of a type.
 */
public interface CandidatePass {

    /**
     * The method recorded on every candidate this pass emits.
     */
    MatchMethod method();

    /**
     * Scans the entities and offers every matched pair to the collector.
     */
    void findCandidates(List<Entity> entities, CandidateCollector collector);
}
