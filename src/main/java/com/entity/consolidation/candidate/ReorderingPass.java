package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.rules.NameNormalizer;

/**
 * Pass 2: entities whose names hold the same tokens in a different order
 * ("Epstein Jeffrey" / "Jeffrey Epstein"). Names need at least two tokens.
 */
public class ReorderingPass extends GroupingPass {

    @Override
    public MatchMethod method() {
        return MatchMethod.NAME_REORDERING;
    }

    @Override
    protected String groupKey(Entity entity) {
        String normalized = entity.getNormalizedName();
        if (normalized.length() < MIN_KEY_LENGTH || normalized.indexOf(' ') < 0) {
            return null;
        }
        return NameNormalizer.tokenSortKey(normalized);
    }

    @Override
    protected String reason() {
        return "Name word order variation";
    }
}
