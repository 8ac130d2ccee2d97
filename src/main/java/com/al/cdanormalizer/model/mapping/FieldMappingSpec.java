package com.al.cdanormalizer.model.mapping;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Declarative descriptor of one field: where it lives (path relative to the
 * section's {@code entry} element) and how its value is post-processed.
 */
@Value
@Builder
@Jacksonized
public class FieldMappingSpec {
    String label;
    String path;
    boolean requiresTranslation;
    boolean hasValueSet;
    /** Code system assumed when the element itself carries none. */
    String codeSystem;
}
