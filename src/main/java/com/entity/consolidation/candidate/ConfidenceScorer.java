package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.MatchMethod;

/**
 * Assigns a 0-100 confidence to a candidate from the way it was detected.
 */
public final class ConfidenceScorer {

    static final double TYPO_PENALTY_PER_EDIT = 2.5;

    private ConfidenceScorer() {
        // Utility class
    }

    /**
     * @param editDistance Levenshtein distance, only read for {@link MatchMethod#TYPO_CORRECTION}
     */
    public static double score(MatchMethod method, int editDistance) {
        return switch (method) {
            case KNOWN_ALIAS, EXACT_MATCH -> 100.0;
            case NAME_REORDERING -> 98.0;
            case TYPO_CORRECTION -> 100.0 - TYPO_PENALTY_PER_EDIT * editDistance;
            case PREFIX_STRIPPING -> 90.0;
            case NICKNAME_RESOLUTION -> 85.0;
        };
    }
}
