package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.Section;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a country-profile extraction: the sections it populated, with
 * convenience views per category.
 */
@Value
public class CountryExtraction {

    String countryCode;
    List<Section> sections;

    public static CountryExtraction empty(String countryCode) {
        return new CountryExtraction(countryCode, List.of());
    }

    public List<Entry> getAllergies() {
        return entriesOf(ClinicalCategory.ALLERGY);
    }

    public List<Entry> getMedications() {
        return entriesOf(ClinicalCategory.MEDICATION);
    }

    public List<Entry> getProblems() {
        return entriesOf(ClinicalCategory.PROBLEM);
    }

    public boolean hasClinicalData() {
        return sections.stream().anyMatch(section -> !section.getEntries().isEmpty());
    }

    private List<Entry> entriesOf(ClinicalCategory category) {
        return sections.stream()
                .filter(section -> section.getCategory() == category)
                .flatMap(section -> section.getEntries().stream())
                .collect(Collectors.toList());
    }
}
