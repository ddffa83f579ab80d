package com.entity.consolidation.core.model;

import java.util.Locale;

/**
 * How a merge candidate was detected.
 * The code is the stable value written to the audit trail.
 */
public enum MatchMethod {
    /**
     * Listed as a variant of a canonical name in the configured alias file.
     * The canonical entity is always the target.
     */
    KNOWN_ALIAS("known_alias"),

    /**
     * Identical after normalization.
     */
    EXACT_MATCH("exact_match"),

    /**
     * Same tokens in a different order ("Epstein Jeffrey" / "Jeffrey Epstein").
     */
    NAME_REORDERING("name_reordering"),

    /**
     * Small edit distance between neighbouring names. Candidates carry the distance.
     */
    TYPO_CORRECTION("typo_correction"),

    /**
     * Equal once a leading honorific or title is removed.
     */
    PREFIX_STRIPPING("prefix_stripping"),

    /**
     * First names from the same nickname group, remaining tokens identical.
     */
    NICKNAME_RESOLUTION("nickname_resolution");

    private final String code;

    MatchMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a pass name as given on the command line ("exact", "typo", ...) or an audit code.
     *
     * @throws IllegalArgumentException if the name matches no method
     */
    public static MatchMethod fromPassName(String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "exact", "exact_match" -> EXACT_MATCH;
            case "known", "alias", "known_alias" -> KNOWN_ALIAS;
            case "reordering", "name_reordering" -> NAME_REORDERING;
            case "typo", "fuzzy", "typo_correction" -> TYPO_CORRECTION;
            case "prefix", "prefix_stripping" -> PREFIX_STRIPPING;
            case "nickname", "nickname_resolution" -> NICKNAME_RESOLUTION;
            default -> throw new IllegalArgumentException("Unknown matching pass: " + name);
        };
    }
}
