package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.rules.NameVariants;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pass 5: "Bill Gates" and "William Gates".
 * First tokens must share a nickname group and everything after the first token must be
 * identical, so a differing middle name blocks the match.
 */
public class NicknamePass implements CandidatePass {

    private final NameVariants nameVariants;

    public NicknamePass(NameVariants nameVariants) {
        this.nameVariants = nameVariants;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.NICKNAME_RESOLUTION;
    }

    @Override
    public void findCandidates(List<Entity> entities, CandidateCollector collector) {
        // "rest of name" -> entities; equal rest is required, so it doubles as the blocking key
        Map<String, List<Entity>> byRest = new LinkedHashMap<>();
        for (Entity entity : entities) {
            String normalized = entity.getNormalizedName();
            int space = normalized.indexOf(' ');
            if (space < 0) {
                continue;
            }
            byRest.computeIfAbsent(normalized.substring(space + 1), k -> new ArrayList<>()).add(entity);
        }

        for (List<Entity> bucket : byRest.values()) {
            for (int i = 0; i < bucket.size(); i++) {
                Entity entity = bucket.get(i);
                String first = firstToken(entity);
                Optional<String> group = nameVariants.nicknameGroup(first);
                if (group.isEmpty()) {
                    continue;
                }
                for (int j = i + 1; j < bucket.size(); j++) {
                    Entity other = bucket.get(j);
                    String otherFirst = firstToken(other);
                    if (group.equals(nameVariants.nicknameGroup(otherFirst))) {
                        collector.offer(entity, other, method(),
                                "Nickname match: " + first + " ~ " + otherFirst);
                    }
                }
            }
        }
    }

    private static String firstToken(Entity entity) {
        String normalized = entity.getNormalizedName();
        return normalized.substring(0, normalized.indexOf(' '));
    }
}
