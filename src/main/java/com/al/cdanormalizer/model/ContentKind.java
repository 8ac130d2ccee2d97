package com.al.cdanormalizer.model;

public enum ContentKind {
    STRUCTURED_MARKUP,
    RENDERED_MARKUP,
    UNKNOWN
}
