package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.model.ValueSetConcept;

import java.util.Optional;

/**
 * Read-only access to the concept catalogue. Implementations only expose
 * active concepts and must be safe for concurrent reads.
 */
public interface TerminologyCatalogue {

    /**
     * Concept with exactly this code in the given code system. Any identifier of
     * the system (OID, URI or name) is accepted.
     */
    Optional<ValueSetConcept> lookupConcept(String code, String codeSystem);

    /**
     * Concept with exactly this code in any code system.
     */
    Optional<ValueSetConcept> lookupConceptByCode(String code);

    /**
     * Concept whose canonical display or any translated display equals the text,
     * ignoring case.
     */
    Optional<ValueSetConcept> lookupConceptByDisplay(String display);

    /**
     * Concept with exactly this code whose canonical display contains the text,
     * ignoring case.
     */
    Optional<ValueSetConcept> searchConceptByDisplay(String code, String fragment);

    /**
     * Display of the concept in the given language, matched on the primary
     * language subtag ("fr" matches "fr-BE").
     */
    default Optional<String> lookupTranslation(ValueSetConcept concept, String language) {
        if (concept == null || language == null || concept.getTranslations() == null) {
            return Optional.empty();
        }
        String wanted = LanguageCodes.primary(language);
        return concept.getTranslations().stream()
                .filter(t -> wanted.equals(LanguageCodes.primary(t.getLanguageCode())))
                .map(t -> t.getTranslatedDisplay())
                .filter(display -> display != null && !display.isBlank())
                .findFirst();
    }
}
