package com.entity.consolidation.rules;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw entity names for comparison.
 *
 * <p>{@link #normalize(String)} lowercases, removes every character that is neither a word
 * character nor whitespace, collapses whitespace runs to a single space and trims. Punctuation
 * is removed before whitespace is collapsed so that the result is a fixed point:
 * {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 */
public final class NameNormalizer {

    // \s alone is ASCII-only; Unicode space separators and the BOM are whitespace too
    private static final String SPACE_CLASS = "\\s\\p{Z}\\uFEFF";
    private static final Pattern NON_WORD = Pattern.compile("[^\\w" + SPACE_CLASS + "]");
    private static final Pattern WHITESPACE = Pattern.compile("[" + SPACE_CLASS + "]+");

    private NameNormalizer() {
        // Utility class
    }

    /**
     * Normalizes a raw name. Null or blank input yields an empty string.
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String lower = name.toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Splits a name into normalized tokens.
     */
    public static List<String> tokens(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }

    /**
     * Normalized tokens sorted lexicographically and joined by single spaces.
     * "Epstein, Jeffrey" and "jeffrey epstein" share the key "epstein jeffrey".
     */
    public static String tokenSortKey(String name) {
        String[] tokens = tokens(name).toArray(new String[0]);
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    /**
     * Whether two names consist of the same tokens in a different (or the same) order.
     * Both names need at least two tokens.
     */
    public static boolean isReordering(String a, String b) {
        List<String> tokensA = tokens(a);
        List<String> tokensB = tokens(b);
        if (tokensA.size() < 2 || tokensB.size() < 2 || tokensA.size() != tokensB.size()) {
            return false;
        }
        return tokenSortKey(a).equals(tokenSortKey(b));
    }
}
