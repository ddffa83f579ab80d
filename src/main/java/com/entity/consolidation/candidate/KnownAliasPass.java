package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.rules.KnownAliases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges curated variants into their canonical entity.
 *
 * <p>The canonical entity is the one whose full name equals the canonical name; when several
 * do, the highest ranked under {@link CandidateCollector#CANONICAL_FIRST}. Each variant is
 * looked up by exact full name first and case-insensitively only when that finds nothing.
 * Candidates always point at the canonical entity, whatever the mention counts.</p>
 */
public class KnownAliasPass implements CandidatePass {
    private static final Logger log = LoggerFactory.getLogger(KnownAliasPass.class);

    private final KnownAliases knownAliases;

    public KnownAliasPass(KnownAliases knownAliases) {
        this.knownAliases = knownAliases;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.KNOWN_ALIAS;
    }

    @Override
    public void findCandidates(List<Entity> entities, CandidateCollector collector) {
        if (knownAliases.isEmpty()) {
            return;
        }
        Map<String, List<Entity>> byName = new HashMap<>();
        Map<String, List<Entity>> byLowerName = new HashMap<>();
        for (Entity entity : entities) {
            String name = entity.getFullName().trim();
            byName.computeIfAbsent(name, k -> new ArrayList<>()).add(entity);
            byLowerName.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(entity);
        }

        for (String canonicalName : knownAliases.getCanonicalNames()) {
            List<Entity> matches = byName.getOrDefault(canonicalName, List.of());
            if (matches.isEmpty()) {
                log.debug("Known alias canonical entity not found: '{}'", canonicalName);
                continue;
            }
            Entity canonical = matches.stream().min(CandidateCollector.CANONICAL_FIRST).orElseThrow();

            for (String variant : knownAliases.variantsOf(canonicalName)) {
                List<Entity> found = byName.getOrDefault(variant, List.of());
                if (found.isEmpty()) {
                    found = byLowerName.getOrDefault(variant.toLowerCase(Locale.ROOT), List.of());
                }
                for (Entity source : found) {
                    if (source.getId() != canonical.getId()) {
                        collector.offerDirected(source, canonical, method(), 0,
                                "Known alias of \"" + canonicalName + "\"");
                    }
                }
            }
        }
    }
}
