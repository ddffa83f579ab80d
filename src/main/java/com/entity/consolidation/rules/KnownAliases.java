package com.entity.consolidation.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Curated canonical names and the variants known to refer to the same entity.
 *
 * <p>Loaded from a JSON object mapping each canonical full name to its variants:</p>
 * <pre>
 * {
 *   "Acme Corporation": ["Acme", "Acme Corp", "ACME Inc"],
 *   "Jane Q Public": ["J Q Public", "Ms Public"]
 * }
 * </pre>
 * <p>Instances are immutable and keep the file's order.</p>
 */
public final class KnownAliases {

    private static final TypeReference<LinkedHashMap<String, List<String>>> ALIAS_MAP = new TypeReference<>() {};

    private static final KnownAliases EMPTY = new KnownAliases(Map.of());

    private final Map<String, List<String>> variantsByCanonical;

    private KnownAliases(Map<String, List<String>> variantsByCanonical) {
        this.variantsByCanonical = variantsByCanonical;
    }

    public static KnownAliases empty() {
        return EMPTY;
    }

    /**
     * Copies the given mapping. Blank names and variants equal to their canonical name are dropped.
     */
    public static KnownAliases of(Map<String, ? extends Collection<String>> variantsByCanonical) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        variantsByCanonical.forEach((canonical, variants) -> {
            if (canonical == null || canonical.isBlank() || variants == null) {
                return;
            }
            String name = canonical.trim();
            List<String> cleaned = new ArrayList<>();
            for (String variant : variants) {
                if (variant != null && !variant.isBlank() && !variant.trim().equals(name)
                        && !cleaned.contains(variant.trim())) {
                    cleaned.add(variant.trim());
                }
            }
            if (!cleaned.isEmpty()) {
                copy.merge(name, List.copyOf(cleaned), KnownAliases::concat);
            }
        });
        return copy.isEmpty() ? EMPTY : new KnownAliases(Collections.unmodifiableMap(copy));
    }

    /**
     * Reads the JSON alias file.
     *
     * @throws IOException if the file cannot be read or is not a JSON object of string arrays
     */
    public static KnownAliases load(Path file) throws IOException {
        return load(file, new ObjectMapper());
    }

    public static KnownAliases load(Path file, ObjectMapper objectMapper) throws IOException {
        Map<String, List<String>> raw = objectMapper.readValue(file.toFile(), ALIAS_MAP);
        if (raw == null) {
            return EMPTY;
        }
        return of(raw);
    }

    public boolean isEmpty() {
        return variantsByCanonical.isEmpty();
    }

    public int size() {
        return variantsByCanonical.size();
    }

    public Set<String> getCanonicalNames() {
        return variantsByCanonical.keySet();
    }

    public List<String> variantsOf(String canonicalName) {
        return variantsByCanonical.getOrDefault(canonicalName, List.of());
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> merged = new ArrayList<>(a);
        b.stream().filter(v -> !merged.contains(v)).forEach(merged::add);
        return List.copyOf(merged);
    }
}
