package com.entity.consolidation.rules;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup tables used by the matching passes: extraction-artifact stop-words,
 * honorific/title prefixes and nickname groups.
 * Built once at startup and shared by reference; instances are immutable.
 */
public final class NameVariants {

    private final Set<String> stopWords;
    private final List<String> titlePrefixes;
    private final Map<String, String> nicknameGroups;

    private NameVariants(Builder builder) {
        this.stopWords = Set.copyOf(builder.stopWords);
        // Longest titles first so "prime minister" wins over "minister"
        this.titlePrefixes = builder.titlePrefixes.stream()
                .sorted(Comparator.comparingInt((String t) -> t.split(" ").length).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
        this.nicknameGroups = Map.copyOf(builder.nicknameGroups);
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    public List<String> getTitlePrefixes() {
        return titlePrefixes;
    }

    /**
     * Whether the first token of a normalized name is an extraction-artifact stop-word.
     */
    public boolean startsWithStopWord(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return false;
        }
        int space = normalizedName.indexOf(' ');
        String first = space < 0 ? normalizedName : normalizedName.substring(0, space);
        return stopWords.contains(first);
    }

    /**
     * Finds the title that a normalized name starts with, matched on whole tokens.
     */
    public Optional<String> leadingTitle(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return Optional.empty();
        }
        for (String title : titlePrefixes) {
            if (normalizedName.startsWith(title + " ")) {
                return Optional.of(title);
            }
        }
        return Optional.empty();
    }

    /**
     * Canonical form of a first name's nickname group ("bill" → "william").
     * Formal names map to themselves.
     */
    public Optional<String> nicknameGroup(String firstName) {
        if (firstName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nicknameGroups.get(firstName.toLowerCase(Locale.ROOT)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> stopWords = new HashSet<>();
        private final Set<String> titlePrefixes = new HashSet<>();
        private final Map<String, String> nicknameGroups = new HashMap<>();

        public Builder stopWords(Collection<String> words) {
            words.forEach(w -> stopWords.add(NameNormalizer.normalize(w)));
            return this;
        }

        public Builder titlePrefixes(Collection<String> titles) {
            titles.forEach(t -> titlePrefixes.add(NameNormalizer.normalize(t)));
            return this;
        }

        /**
         * Registers a formal first name together with its nicknames.
         * A nickname already claimed by another group keeps its first registration.
         */
        public Builder nicknames(String formal, Collection<String> nicknames) {
            String canonical = NameNormalizer.normalize(formal);
            nicknameGroups.putIfAbsent(canonical, canonical);
            for (String nick : nicknames) {
                nicknameGroups.putIfAbsent(NameNormalizer.normalize(nick), canonical);
            }
            return this;
        }

        public NameVariants build() {
            stopWords.remove("");
            titlePrefixes.remove("");
            nicknameGroups.remove("");
            return new NameVariants(this);
        }
    }
}
