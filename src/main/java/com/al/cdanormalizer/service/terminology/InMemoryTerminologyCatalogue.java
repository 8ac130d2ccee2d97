package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.model.ConceptTranslation;
import com.al.cdanormalizer.model.ValueSetConcept;
import com.al.cdanormalizer.util.CodeSystems;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue held in memory, seeded from a JSON array of concepts. Indexes are
 * built once in the constructor and only read afterwards.
 */
@Slf4j
public class InMemoryTerminologyCatalogue implements TerminologyCatalogue {

    private final List<ValueSetConcept> concepts;
    private final Map<String, List<ValueSetConcept>> byCode = new HashMap<>();
    private final Map<String, ValueSetConcept> byDisplay = new HashMap<>();

    public InMemoryTerminologyCatalogue(List<ValueSetConcept> seed) {
        List<ValueSetConcept> active = new ArrayList<>();
        for (ValueSetConcept concept : seed) {
            if (!concept.isActive() || StringUtils.isBlank(concept.getCode())) {
                continue;
            }
            active.add(concept);
            byCode.computeIfAbsent(concept.getCode().trim(), k -> new ArrayList<>()).add(concept);
            indexDisplay(concept.getDisplay(), concept);
            if (concept.getTranslations() != null) {
                for (ConceptTranslation translation : concept.getTranslations()) {
                    indexDisplay(translation.getTranslatedDisplay(), concept);
                }
            }
        }
        this.concepts = Collections.unmodifiableList(active);
        log.info("In-memory terminology catalogue loaded with {} active concepts", concepts.size());
    }

    /**
     * Load a catalogue from a JSON resource holding an array of concepts.
     */
    public static InMemoryTerminologyCatalogue fromResource(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            log.warn("Terminology seed {} not found; starting with an empty catalogue", resource);
            return new InMemoryTerminologyCatalogue(List.of());
        }
        try (InputStream in = resource.getInputStream()) {
            List<ValueSetConcept> seed = objectMapper.readValue(in, new TypeReference<List<ValueSetConcept>>() {
            });
            return new InMemoryTerminologyCatalogue(seed);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load terminology seed " + resource, e);
        }
    }

    @Override
    public Optional<ValueSetConcept> lookupConcept(String code, String codeSystem) {
        if (StringUtils.isAnyBlank(code, codeSystem)) {
            return Optional.empty();
        }
        return byCode.getOrDefault(code.trim(), List.of()).stream()
                .filter(concept -> CodeSystems.sameSystem(concept.getCodeSystem(), codeSystem))
                .findFirst();
    }

    @Override
    public Optional<ValueSetConcept> lookupConceptByCode(String code) {
        if (StringUtils.isBlank(code)) {
            return Optional.empty();
        }
        return byCode.getOrDefault(code.trim(), List.of()).stream().findFirst();
    }

    @Override
    public Optional<ValueSetConcept> lookupConceptByDisplay(String display) {
        if (StringUtils.isBlank(display)) {
            return Optional.empty();
        }
        return Optional.ofNullable(byDisplay.get(key(display)));
    }

    @Override
    public Optional<ValueSetConcept> searchConceptByDisplay(String code, String fragment) {
        if (StringUtils.isAnyBlank(code, fragment)) {
            return Optional.empty();
        }
        String wanted = key(fragment);
        return byCode.getOrDefault(code.trim(), List.of()).stream()
                .filter(concept -> concept.getDisplay() != null && key(concept.getDisplay()).contains(wanted))
                .findFirst();
    }

    public int size() {
        return concepts.size();
    }

    private void indexDisplay(String display, ValueSetConcept concept) {
        if (StringUtils.isNotBlank(display)) {
            byDisplay.putIfAbsent(key(display), concept);
        }
    }

    private static String key(String text) {
        return StringUtils.normalizeSpace(text).toLowerCase(Locale.ROOT);
    }
}
