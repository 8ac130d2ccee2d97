package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.model.SectionTitle;
import com.al.cdanormalizer.util.CodeSystems;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Resolves section titles through terminology data only: the section code in
 * the catalogue first, then term-by-term translation of the title text, then
 * the original title.
 */
@Service
@Slf4j
public class SectionTitleTranslator {

    private final TerminologyResolver resolver;
    private final MedicalTermTranslator termTranslator;

    public SectionTitleTranslator(TerminologyResolver resolver, MedicalTermTranslator termTranslator) {
        this.resolver = resolver;
        this.termTranslator = termTranslator;
    }

    public SectionTitle translateTitle(String sectionCode, String originalTitle, String sourceLanguage,
            String targetLanguage) {
        String original = StringUtils.trimToEmpty(originalTitle);

        if (StringUtils.isNotBlank(sectionCode)) {
            ResolvedTerm term = resolver.resolveTerm(sectionCode, CodeSystems.LOINC, null, targetLanguage);
            if (term.isCatalogueHit() || acceptsFallback(term, targetLanguage)) {
                log.debug("Section {} title resolved from {}", sectionCode, term.getSource());
                return new SectionTitle(originalOrDisplay(original, term), term.getDisplay());
            }
        }

        if (!original.isEmpty()) {
            String keywordTranslated = termTranslator.translateMedicalTerms(original, sourceLanguage, targetLanguage);
            if (StringUtils.isNotBlank(keywordTranslated) && !keywordTranslated.equals(original)) {
                return new SectionTitle(original, keywordTranslated);
            }
        }
        return SectionTitle.untranslated(original);
    }

    // The fallback table is English; use it only for English output.
    private static boolean acceptsFallback(ResolvedTerm term, String targetLanguage) {
        return term.getSource() == ResolvedTerm.Source.FALLBACK_TABLE
                && (StringUtils.isBlank(targetLanguage) || "en".equals(LanguageCodes.primary(targetLanguage)));
    }

    private static String originalOrDisplay(String original, ResolvedTerm term) {
        return original.isEmpty() ? term.getDisplay() : original;
    }
}
