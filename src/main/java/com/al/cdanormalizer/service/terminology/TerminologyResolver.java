package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.ValueSetConcept;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns raw codes into display text. Never throws: catalogue failures are
 * logged and treated as misses, and the result is non-empty whenever any
 * input was.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>code and code system in the catalogue</li>
 * <li>code alone in the catalogue, preferring the concept whose display
 * contains the raw text</li>
 * <li>catalogue display or translated display equal to the raw text, ignoring case</li>
 * <li>fixed fallback table</li>
 * <li>raw text from the document</li>
 * <li>the code itself</li>
 * </ol>
 * A translation into the requested language is used after steps 1 to 3 when
 * the catalogue has one. Text is never matched against a different code's
 * display by substring.
 */
@Service
@Slf4j
public class TerminologyResolver {

    private final TerminologyCatalogue catalogue;
    private final MeterRegistry meterRegistry;

    public TerminologyResolver(TerminologyCatalogue catalogue, MeterRegistry meterRegistry) {
        this.catalogue = catalogue;
        this.meterRegistry = meterRegistry;
    }

    public String resolve(String code, String codeSystem, String rawDisplay) {
        return resolveTerm(code, codeSystem, rawDisplay, null).getDisplay();
    }

    public String resolve(String code, String codeSystem, String rawDisplay, String language) {
        return resolveTerm(code, codeSystem, rawDisplay, language).getDisplay();
    }

    public ResolvedTerm resolveTerm(String code, String codeSystem, String rawDisplay, String language) {
        String trimmedCode = StringUtils.trimToNull(code);
        String trimmedRaw = StringUtils.trimToNull(rawDisplay);

        if (trimmedCode != null) {
            Optional<ValueSetConcept> concept = StringUtils.isNotBlank(codeSystem)
                    ? safely(() -> catalogue.lookupConcept(trimmedCode, codeSystem), trimmedCode)
                    : Optional.empty();
            if (concept.isEmpty() && trimmedRaw != null) {
                concept = safely(() -> catalogue.searchConceptByDisplay(trimmedCode, trimmedRaw), trimmedCode);
            }
            if (concept.isEmpty()) {
                concept = safely(() -> catalogue.lookupConceptByCode(trimmedCode), trimmedCode);
            }
            Optional<ResolvedTerm> fromCatalogue = concept.flatMap(c -> display(c, language));
            if (fromCatalogue.isPresent()) {
                return fromCatalogue.get();
            }
        }

        if (trimmedRaw != null) {
            Optional<ResolvedTerm> byDisplay = safely(() -> catalogue.lookupConceptByDisplay(trimmedRaw), trimmedRaw)
                    .flatMap(c -> display(c, language));
            if (byDisplay.isPresent()) {
                return new ResolvedTerm(byDisplay.get().getDisplay(), ResolvedTerm.Source.DISPLAY_MATCH);
            }
        }

        Optional<String> fallback = FallbackTerminology.lookup(trimmedCode);
        if (fallback.isPresent()) {
            return new ResolvedTerm(fallback.get(), ResolvedTerm.Source.FALLBACK_TABLE);
        }

        recordMiss();
        if (trimmedRaw != null) {
            return new ResolvedTerm(trimmedRaw, ResolvedTerm.Source.RAW_DISPLAY);
        }
        if (trimmedCode != null) {
            return new ResolvedTerm(trimmedCode, ResolvedTerm.Source.CODE);
        }
        return new ResolvedTerm("", ResolvedTerm.Source.NONE);
    }

    private Optional<ResolvedTerm> display(ValueSetConcept concept, String language) {
        if (language != null) {
            Optional<String> translated = safely(() -> catalogue.lookupTranslation(concept, language),
                    concept.getCode());
            if (translated.isPresent()) {
                return Optional.of(new ResolvedTerm(translated.get().trim(),
                        ResolvedTerm.Source.CATALOGUE_TRANSLATION));
            }
        }
        if (StringUtils.isBlank(concept.getDisplay())) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedTerm(concept.getDisplay().trim(), ResolvedTerm.Source.CATALOGUE));
    }

    private <T> Optional<T> safely(Supplier<Optional<T>> lookup, String term) {
        try {
            Optional<T> result = lookup.get();
            return result != null ? result : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Terminology catalogue lookup failed for '{}': {}", term, e.getMessage());
            meterRegistry.counter("cda.terminology.errors").increment();
            return Optional.empty();
        }
    }

    private void recordMiss() {
        meterRegistry.counter("cda.pipeline.issues", "kind", ErrorKind.TERMINOLOGY_MISS.name()).increment();
    }
}
