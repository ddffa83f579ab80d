package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;

/**
 * Pass 1: entities whose normalized names are identical.
 * Keys shorter than three characters are ignored to avoid merging initials and OCR debris.
 */
public class ExactMatchPass extends GroupingPass {

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT_MATCH;
    }

    @Override
    protected String groupKey(Entity entity) {
        String normalized = entity.getNormalizedName();
        return normalized.length() < MIN_KEY_LENGTH ? null : normalized;
    }

    @Override
    protected String reason() {
        return "Exact match (case-insensitive)";
    }
}
