package com.entity.consolidation.api;

/**
 * Fatal condition that stops a run before, or instead of, any merge.
 */
public class ConsolidationException extends RuntimeException {

    public ConsolidationException(String message) {
        super(message);
    }

    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
