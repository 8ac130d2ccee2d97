package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.config.PipelineProperties;
import com.al.cdanormalizer.config.PipelineProperties.CategoryVariants;
import com.al.cdanormalizer.config.PipelineProperties.CountryProfile;
import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.service.ResultAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction with the path variants of one national dialect. Covers the
 * categories most prone to drift: allergies, medications and problems.
 *
 * <p>
 * For each entry the first variant that yields a value fills the category's
 * required field; variants are never combined. Entries where no variant
 * matches are dropped. The remaining fields are read with the structural
 * candidates so they match what the other strategies read.
 */
@Component
@Slf4j
public class CountrySpecificExtractor {

    private final PipelineProperties properties;
    private final GenericStructuralParser structuralParser;
    private final FieldValueFactory fieldValueFactory;
    private final ResultAssembler resultAssembler;

    public CountrySpecificExtractor(PipelineProperties properties, GenericStructuralParser structuralParser,
            FieldValueFactory fieldValueFactory, ResultAssembler resultAssembler) {
        this.properties = properties;
        this.structuralParser = structuralParser;
        this.fieldValueFactory = fieldValueFactory;
        this.resultAssembler = resultAssembler;
    }

    public CountryExtraction extract(ExtractionContext context, String countryCode) {
        CountryProfile profile = properties.countryProfile(countryCode);
        if (profile == null || !context.isStructured()) {
            log.debug("No country profile for {}", countryCode);
            return CountryExtraction.empty(countryCode);
        }

        List<Section> sections = new ArrayList<>();
        for (SectionNode node : structuralParser.findSections(context.getDom())) {
            ClinicalCategory category = categoryFor(profile, node.getCode());
            if (category == null) {
                continue;
            }
            List<Entry> entries = extractEntries(node, category, variantsFor(profile, category), context);
            if (!entries.isEmpty()) {
                sections.add(resultAssembler.buildSection(node.getCode(), node.getTitle(), category, entries,
                        context));
            }
        }
        CountryExtraction extraction = new CountryExtraction(countryCode, sections);
        log.info("Country profile {} extracted allergies={}, medications={}, problems={}", countryCode,
                extraction.getAllergies().size(), extraction.getMedications().size(),
                extraction.getProblems().size());
        return extraction;
    }

    private List<Entry> extractEntries(SectionNode node, ClinicalCategory category, CategoryVariants variants,
            ExtractionContext context) {
        String requiredLabel = FieldLabels.requiredLabel(category);
        List<Entry> entries = new ArrayList<>();
        for (Element entryElement : GenericStructuralParser.limit(node.getEntryElements(), context)) {
            FieldValue required = GenericStructuralParser.firstMatch(entryElement, variants.getPaths())
                    .map(match -> fieldValueFactory.create(requiredLabel, match.getValue(), false,
                            true, null, context))
                    .orElse(null);
            if (required == null) {
                continue;
            }
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            fields.put(requiredLabel, required);
            structuralParser.readCandidates(entryElement, category, context)
                    .forEach(fields::putIfAbsent);
            entries.add(new Entry(category, fields));
        }
        return entries;
    }

    private static ClinicalCategory categoryFor(CountryProfile profile, String sectionCode) {
        if (sectionCode == null) {
            return null;
        }
        if (profile.getAllergies().getSectionCodes().contains(sectionCode)) {
            return ClinicalCategory.ALLERGY;
        }
        if (profile.getMedications().getSectionCodes().contains(sectionCode)) {
            return ClinicalCategory.MEDICATION;
        }
        if (profile.getProblems().getSectionCodes().contains(sectionCode)) {
            return ClinicalCategory.PROBLEM;
        }
        return null;
    }

    private static CategoryVariants variantsFor(CountryProfile profile, ClinicalCategory category) {
        switch (category) {
            case ALLERGY:
                return profile.getAllergies();
            case MEDICATION:
                return profile.getMedications();
            default:
                return profile.getProblems();
        }
    }
}
