package com.entity.consolidation.store;

import java.util.regex.Pattern;

/**
 * Guards table and column names that are spliced into SQL text.
 * Values always travel as bound parameters; only identifiers pass through here.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
        // Utility class
    }

    /**
     * Returns the identifier unchanged if it is a plain SQL name.
     *
     * @throws IllegalArgumentException otherwise
     */
    public static String requireValid(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return identifier;
    }
}
