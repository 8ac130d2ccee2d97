package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.model.ValueSetConcept;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces recognised medical terms inside free text with their catalogue
 * translation. Terms are recognised by matching the whole text, then each word,
 * against catalogue displays in any language.
 */
@Service
@Slf4j
public class MedicalTermTranslator {

    private static final Pattern WORD = Pattern.compile("\\p{L}[\\p{L}'-]{2,}");

    private final TerminologyCatalogue catalogue;

    public MedicalTermTranslator(TerminologyCatalogue catalogue) {
        this.catalogue = catalogue;
    }

    /**
     * Translate the medical terms of {@code text} into {@code targetLanguage}.
     *
     * @return the translated text, or the input unchanged when nothing was recognised
     */
    public String translateMedicalTerms(String text, String sourceLanguage, String targetLanguage) {
        if (StringUtils.isBlank(text) || StringUtils.isBlank(targetLanguage)
                || LanguageCodes.sameLanguage(sourceLanguage, targetLanguage)) {
            return text;
        }
        Optional<String> whole = translateTerm(text.trim(), targetLanguage);
        if (whole.isPresent()) {
            return whole.get();
        }

        Map<String, String> translations = new HashMap<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            String word = matcher.group();
            if (!translations.containsKey(word)) {
                translateTerm(word, targetLanguage).ifPresent(t -> translations.put(word, t));
            }
        }
        if (translations.isEmpty()) {
            return text;
        }
        // one pass, so inserted translations are never matched again
        String alternation = translations.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        Pattern terms = Pattern.compile("(?<!\\p{L})(?:" + alternation + ")(?!\\p{L})");
        return terms.matcher(text).replaceAll(m -> Matcher.quoteReplacement(translations.get(m.group())));
    }

    private Optional<String> translateTerm(String term, String targetLanguage) {
        try {
            Optional<ValueSetConcept> concept = catalogue.lookupConceptByDisplay(term);
            if (concept.isEmpty()) {
                return Optional.empty();
            }
            Optional<String> translation = catalogue.lookupTranslation(concept.get(), targetLanguage);
            if (translation.isPresent()) {
                return translation;
            }
            // English is the catalogue's canonical language
            return "en".equals(LanguageCodes.primary(targetLanguage))
                    ? Optional.ofNullable(StringUtils.trimToNull(concept.get().getDisplay()))
                    : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Term translation lookup failed for '{}': {}", term, e.getMessage());
            return Optional.empty();
        }
    }
}
