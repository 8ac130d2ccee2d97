package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.config.CacheConfig;
import com.al.cdanormalizer.model.ValueSetConcept;
import com.al.cdanormalizer.repository.ValueSetConceptRepository;
import com.al.cdanormalizer.util.CodeSystems;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.cache.annotation.Cacheable;

import java.util.Optional;

/**
 * Catalogue backed by the {@code value_set_concepts} collection. Lookups are
 * cached since the collection is treated as read-only.
 */
@RequiredArgsConstructor
public class MongoTerminologyCatalogue implements TerminologyCatalogue {

    private final ValueSetConceptRepository repository;

    @Override
    @Cacheable(cacheNames = CacheConfig.CONCEPTS_BY_CODE, key = "#p0 + '|' + #p1")
    public Optional<ValueSetConcept> lookupConcept(String code, String codeSystem) {
        if (StringUtils.isAnyBlank(code, codeSystem)) {
            return Optional.empty();
        }
        return repository.findFirstByCodeAndCodeSystemInAndStatus(code.trim(), CodeSystems.aliases(codeSystem),
                ValueSetConcept.STATUS_ACTIVE);
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.CONCEPTS_BY_CODE, key = "#p0 + '|*'")
    public Optional<ValueSetConcept> lookupConceptByCode(String code) {
        if (StringUtils.isBlank(code)) {
            return Optional.empty();
        }
        return repository.findFirstByCodeAndStatus(code.trim(), ValueSetConcept.STATUS_ACTIVE);
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.CONCEPTS_BY_DISPLAY, key = "'=' + #p0")
    public Optional<ValueSetConcept> lookupConceptByDisplay(String display) {
        if (StringUtils.isBlank(display)) {
            return Optional.empty();
        }
        String trimmed = display.trim();
        Optional<ValueSetConcept> canonical = repository.findFirstByDisplayIgnoreCaseAndStatus(trimmed,
                ValueSetConcept.STATUS_ACTIVE);
        if (canonical.isPresent()) {
            return canonical;
        }
        return repository.findFirstByTranslationsTranslatedDisplayIgnoreCaseAndStatus(trimmed,
                ValueSetConcept.STATUS_ACTIVE);
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.CONCEPTS_BY_DISPLAY, key = "'~' + #p0 + '|' + #p1")
    public Optional<ValueSetConcept> searchConceptByDisplay(String code, String fragment) {
        if (StringUtils.isAnyBlank(code, fragment)) {
            return Optional.empty();
        }
        return repository.findFirstByCodeAndDisplayContainingIgnoreCaseAndStatus(code.trim(), fragment.trim(),
                ValueSetConcept.STATUS_ACTIVE);
    }
}
