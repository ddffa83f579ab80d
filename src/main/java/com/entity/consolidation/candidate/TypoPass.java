package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.rules.NameVariants;
import com.entity.consolidation.similarity.LevenshteinDistance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pass 3: sliding-window fuzzy match for OCR and typing errors.
 *
 * <p>Entities are sorted by normalized name and each one is compared with the next
 * {@link #DEFAULT_WINDOW_SIZE} neighbours only, which keeps the pass at O(n × window).
 * A pair is compared only when neither name starts with a stop-word, the anchor is at least
 * {@link #MIN_ANCHOR_LENGTH} characters, the first characters agree and the lengths differ by
 * at most {@link #MAX_LENGTH_DIFFERENCE}. Anchors of 8 to 15 characters need an edit distance of
 * exactly 1; longer anchors accept up to 2. Anything shorter than 8 is left to exact matching.</p>
 */
public class TypoPass implements CandidatePass {

    public static final int DEFAULT_WINDOW_SIZE = 20;
    static final int MIN_ANCHOR_LENGTH = 6;
    static final int MAX_LENGTH_DIFFERENCE = 2;
    static final int SHORT_NAME_MIN = 8;
    static final int SHORT_NAME_MAX = 15;

    private final NameVariants nameVariants;
    private final int windowSize;

    public TypoPass(NameVariants nameVariants) {
        this(nameVariants, DEFAULT_WINDOW_SIZE);
    }

    public TypoPass(NameVariants nameVariants, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.nameVariants = nameVariants;
        this.windowSize = windowSize;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.TYPO_CORRECTION;
    }

    @Override
    public void findCandidates(List<Entity> entities, CandidateCollector collector) {
        List<Entity> sorted = new ArrayList<>(entities);
        sorted.sort(Comparator.comparing(Entity::getNormalizedName).thenComparingLong(Entity::getId));

        for (int i = 0; i < sorted.size(); i++) {
            Entity anchor = sorted.get(i);
            String norm1 = anchor.getNormalizedName();

            if (nameVariants.startsWithStopWord(norm1) || norm1.length() < MIN_ANCHOR_LENGTH) {
                continue;
            }

            int end = Math.min(sorted.size(), i + windowSize + 1);
            for (int j = i + 1; j < end; j++) {
                Entity other = sorted.get(j);
                String norm2 = other.getNormalizedName();

                if (nameVariants.startsWithStopWord(norm2)
                        || norm2.isEmpty()
                        || norm1.charAt(0) != norm2.charAt(0)
                        || Math.abs(norm1.length() - norm2.length()) > MAX_LENGTH_DIFFERENCE) {
                    continue;
                }

                int distance = LevenshteinDistance.compute(norm1, norm2);
                if (accepts(norm1.length(), distance)) {
                    collector.offer(anchor, other, method(), distance,
                            "Typo detected (edit distance: " + distance + ")");
                }
            }
        }
    }

    static boolean accepts(int anchorLength, int distance) {
        if (anchorLength >= SHORT_NAME_MIN && anchorLength <= SHORT_NAME_MAX) {
            return distance == 1;
        }
        return anchorLength > SHORT_NAME_MAX && distance <= 2;
    }
}
