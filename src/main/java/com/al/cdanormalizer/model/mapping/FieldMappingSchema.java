package com.al.cdanormalizer.model.mapping;

import lombok.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Versioned field table keyed by section code, with optional per-country
 * overrides. Immutable after load and shared by all worker threads.
 */
@Value
public class FieldMappingSchema {

    String version;
    Map<String, SectionMapping> sections;
    Map<String, Map<String, SectionMapping>> countryOverrides;

    public FieldMappingSchema(String version, Map<String, SectionMapping> sections,
            Map<String, Map<String, SectionMapping>> countryOverrides) {
        this.version = version;
        this.sections = indexWithAliases(sections);
        Map<String, Map<String, SectionMapping>> overrides = new HashMap<>();
        if (countryOverrides != null) {
            countryOverrides.forEach((country, mappings) -> overrides.put(country.toUpperCase(Locale.ROOT),
                    indexWithAliases(mappings)));
        }
        this.countryOverrides = Collections.unmodifiableMap(overrides);
    }

    /**
     * Field specs for a section code, preferring the country override when one exists.
     */
    public List<FieldMappingSpec> fieldsFor(String sectionCode, String countryCode) {
        if (sectionCode == null) {
            return List.of();
        }
        if (countryCode != null) {
            Map<String, SectionMapping> override = countryOverrides.get(countryCode.toUpperCase(Locale.ROOT));
            if (override != null && override.containsKey(sectionCode)) {
                return override.get(sectionCode).getFields();
            }
        }
        SectionMapping mapping = sections.get(sectionCode);
        return mapping != null ? mapping.getFields() : List.of();
    }

    private static Map<String, SectionMapping> indexWithAliases(Map<String, SectionMapping> source) {
        Map<String, SectionMapping> indexed = new HashMap<>();
        if (source != null) {
            source.forEach((code, mapping) -> {
                indexed.put(code, mapping);
                mapping.getAliases().forEach(alias -> indexed.putIfAbsent(alias, mapping));
            });
        }
        return Collections.unmodifiableMap(indexed);
    }
}
