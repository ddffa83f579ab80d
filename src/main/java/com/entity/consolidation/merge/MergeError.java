package com.entity.consolidation.merge;

import java.util.Objects;

/**
 * Why a single merge failed.
 *
 * @param code    driver result code or a short symbolic code
 * @param message human-readable detail
 */
public record MergeError(Kind kind, String code, String message) {

    public enum Kind {
        /** A UNIQUE or key constraint rejected a write that could not be recovered locally. */
        CONSTRAINT_VIOLATION,
        /** The source or target row was gone when the merge started. */
        NOT_FOUND,
        OTHER
    }

    public MergeError {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static MergeError constraintViolation(String code, String message) {
        return new MergeError(Kind.CONSTRAINT_VIOLATION, code, message);
    }

    public static MergeError notFound(String message) {
        return new MergeError(Kind.NOT_FOUND, "NOT_FOUND", message);
    }

    public static MergeError other(String code, String message) {
        return new MergeError(Kind.OTHER, code, message);
    }
}
