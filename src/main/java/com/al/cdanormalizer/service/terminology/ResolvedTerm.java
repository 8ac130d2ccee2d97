package com.al.cdanormalizer.service.terminology;

import lombok.Value;

/**
 * Display text chosen by the resolver, together with where it came from.
 */
@Value
public class ResolvedTerm {

    String display;
    Source source;

    public enum Source {
        CATALOGUE,
        CATALOGUE_TRANSLATION,
        DISPLAY_MATCH,
        FALLBACK_TABLE,
        RAW_DISPLAY,
        CODE,
        NONE
    }

    public boolean isCatalogueHit() {
        return source == Source.CATALOGUE || source == Source.CATALOGUE_TRANSLATION;
    }
}
