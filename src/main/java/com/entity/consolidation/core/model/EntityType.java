package com.entity.consolidation.core.model;

import java.util.Locale;

/**
 * Entity types stored in the {@code entities.entity_type} column.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    UNKNOWN("Unknown");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    /**
     * Value as stored in the database.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Maps a stored column value (or a command-line argument) to a type.
     * Null, blank and unrecognised values map to {@link #UNKNOWN}.
     */
    public static EntityType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = label.trim();
        for (EntityType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
