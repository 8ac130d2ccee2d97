package com.al.cdanormalizer.model;

/**
 * Failure taxonomy of the pipeline. Only {@link #MALFORMED_DOCUMENT} is fatal;
 * every other kind is recorded on the result and the document still succeeds.
 */
public enum ErrorKind {
    MALFORMED_DOCUMENT(true),
    FIELD_EXTRACTION_MISS(false),
    TERMINOLOGY_MISS(false),
    STRATEGY_EXHAUSTED(false),
    STRATEGY_FAILED(false),
    CACHE_UNAVAILABLE(false);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
