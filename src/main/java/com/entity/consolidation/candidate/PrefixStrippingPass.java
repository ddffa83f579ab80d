package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.rules.NameVariants;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pass 4: "President Bill Clinton" and "Bill Clinton".
 * The name left after removing a leading title must still have two tokens, so
 * "Mr Epstein" is never folded into a bare surname.
 */
public class PrefixStrippingPass implements CandidatePass {

    private final NameVariants nameVariants;

    public PrefixStrippingPass(NameVariants nameVariants) {
        this.nameVariants = nameVariants;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.PREFIX_STRIPPING;
    }

    @Override
    public void findCandidates(List<Entity> entities, CandidateCollector collector) {
        Map<String, Entity> byName = new HashMap<>();
        for (Entity entity : entities) {
            byName.merge(entity.getNormalizedName(), entity,
                    (current, next) -> CandidateCollector.CANONICAL_FIRST.compare(current, next) <= 0 ? current : next);
        }

        for (Entity entity : entities) {
            String normalized = entity.getNormalizedName();
            Optional<String> title = nameVariants.leadingTitle(normalized);
            if (title.isEmpty()) {
                continue;
            }
            String stripped = normalized.substring(title.get().length() + 1);
            if (stripped.indexOf(' ') < 0) {
                continue;
            }
            Entity match = byName.get(stripped);
            if (match != null && match.getId() != entity.getId()) {
                collector.offer(entity, match, method(),
                        "Prefix stripping: \"" + title.get() + "\" removed");
            }
        }
    }
}
