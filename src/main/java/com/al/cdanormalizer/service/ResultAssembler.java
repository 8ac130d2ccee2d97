package com.al.cdanormalizer.service;

import com.al.cdanormalizer.dto.ProcessingResult;
import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.model.ProcessingState;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.model.SectionTitle;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.terminology.SectionTitleTranslator;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the immutable section model and the final result with its counters.
 */
@Component
public class ResultAssembler {

    private final SectionTitleTranslator titleTranslator;

    public ResultAssembler(SectionTitleTranslator titleTranslator) {
        this.titleTranslator = titleTranslator;
    }

    public Section buildSection(String code, String originalTitle, ClinicalCategory category, List<Entry> entries,
            ExtractionContext context) {
        String sectionCode = StringUtils.trimToNull(code);
        SectionTitle title = titleTranslator.translateTitle(sectionCode, originalTitle,
                context.getSourceLanguage(), context.getTargetLanguage());
        return Section.builder()
                .code(sectionCode)
                .category(category != null ? category : ClinicalCategory.resolve(sectionCode, originalTitle))
                .title(title)
                .entries(entries)
                .build();
    }

    /**
     * Assemble a successful result. Medical terms are coded field values; coded
     * sections are sections carrying a section code.
     */
    public ProcessingResult assemble(List<Section> sections, ExtractionMethod method, List<ExtractionMethod> attempted,
            ExtractionContext context) {
        int entries = 0;
        int medicalTerms = 0;
        int codedSections = 0;
        for (Section section : sections) {
            entries += section.getEntryCount();
            if (section.isCoded()) {
                codedSections++;
            }
            for (Entry entry : section.getEntries()) {
                for (FieldValue value : entry.getFields().values()) {
                    if (value.isCoded()) {
                        medicalTerms++;
                    }
                }
            }
        }
        int codedPercentage = sections.isEmpty() ? 0 : Math.round(codedSections * 100f / sections.size());

        return ProcessingResult.builder()
                .success(true)
                .sections(sections)
                .sectionsCount(sections.size())
                .entriesCount(entries)
                .medicalTermsCount(medicalTerms)
                .codedSectionsCount(codedSections)
                .codedPercentage(codedPercentage)
                .translationQuality(qualityOf(codedPercentage))
                .extractionMethod(method)
                .finalState(ProcessingState.ASSEMBLED)
                .contentHash(context.getDocument().getContentHash())
                .sourceLanguage(context.getSourceLanguage())
                .targetLanguage(context.getTargetLanguage())
                .issues(context.getIssues())
                .strategiesAttempted(attempted)
                .build();
    }

    static String qualityOf(int codedPercentage) {
        if (codedPercentage >= 80) {
            return "Excellent";
        }
        if (codedPercentage >= 60) {
            return "Good";
        }
        if (codedPercentage >= 40) {
            return "Fair";
        }
        return "Basic";
    }
}
