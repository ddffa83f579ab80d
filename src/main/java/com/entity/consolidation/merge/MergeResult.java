package com.entity.consolidation.merge;

import java.util.Objects;

/**
 * Result of a merge operation: either a value or a {@link MergeError}.
 */
public record MergeResult<T>(T value, MergeError error) {

    public MergeResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    /**
     * Creates a successful merge result.
     */
    public static <T> MergeResult<T> success(T value) {
        return new MergeResult<>(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Creates a failed merge result.
     */
    public static <T> MergeResult<T> failure(MergeError error) {
        return new MergeResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }
}
