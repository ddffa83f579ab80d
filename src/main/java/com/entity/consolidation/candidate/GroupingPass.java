package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for passes that bucket entities by a derived key.
 * In each bucket with more than one member the most canonical entity is the target
 * and every other member becomes a source.
 */
abstract class GroupingPass implements CandidatePass {

    static final int MIN_KEY_LENGTH = 3;

    /**
     * Bucket key for an entity, or null to leave the entity out of this pass.
     */
    protected abstract String groupKey(Entity entity);

    protected abstract String reason();

    @Override
    public void findCandidates(List<Entity> entities, CandidateCollector collector) {
        Map<String, List<Entity>> groups = new LinkedHashMap<>();
        for (Entity entity : entities) {
            String key = groupKey(entity);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(entity);
            }
        }

        for (List<Entity> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(CandidateCollector.CANONICAL_FIRST);
            Entity target = group.get(0);
            for (int i = 1; i < group.size(); i++) {
                collector.offer(group.get(i), target, method(), reason());
            }
        }
    }
}
