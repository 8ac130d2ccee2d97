package com.al.cdanormalizer.service.mapping;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.model.mapping.FieldMappingSchema;
import com.al.cdanormalizer.model.mapping.FieldMappingSpec;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.extraction.FieldValueFactory;
import com.al.cdanormalizer.util.CdaXml;
import com.al.cdanormalizer.util.ExtractedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the field mapping schema to the entries of one section.
 */
@Component
@Slf4j
public class DeclarativeFieldMapper {

    private final FieldValueFactory fieldValueFactory;

    public DeclarativeFieldMapper(FieldValueFactory fieldValueFactory) {
        this.fieldValueFactory = fieldValueFactory;
    }

    /**
     * Map every {@code entry} child of the section with the schema fields for its
     * code. Value-set fields go through the terminology resolver; the rest keep
     * their raw value. Entries with no populated field are dropped.
     *
     * @return mapped entries; empty when the schema has no fields for the code
     */
    public List<Entry> mapSection(Element sectionElement, String sectionCode, FieldMappingSchema schema,
            ExtractionContext context) {
        List<FieldMappingSpec> specs = schema.fieldsFor(sectionCode, context.getCountryCode());
        if (specs.isEmpty()) {
            return List.of();
        }
        ClinicalCategory category = ClinicalCategory.fromSectionCode(sectionCode);
        List<Element> entryElements = CdaXml.children(sectionElement, "entry");
        int max = context.getMaxEntriesPerSection();

        List<Entry> entries = new ArrayList<>();
        int misses = 0;
        for (int i = 0; i < entryElements.size() && (max <= 0 || i < max); i++) {
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            for (FieldMappingSpec spec : specs) {
                Optional<ExtractedValue> value = CdaXml.readValue(entryElements.get(i), spec.getPath());
                if (value.isEmpty()) {
                    misses++;
                    continue;
                }
                FieldValue fieldValue = fieldValueFactory.create(spec.getLabel(), value.get(),
                        spec.isRequiresTranslation(), spec.isHasValueSet(), spec.getCodeSystem(), context);
                if (fieldValue != null) {
                    fields.put(spec.getLabel(), fieldValue);
                }
            }
            if (!fields.isEmpty()) {
                entries.add(new Entry(category, fields));
            }
        }
        if (misses > 0) {
            context.recordInfo(ErrorKind.FIELD_EXTRACTION_MISS, sectionCode,
                    misses + " mapped field(s) not found in " + entryElements.size() + " entries");
        }
        log.debug("Section {}: {} of {} entries mapped declaratively", sectionCode, entries.size(),
                entryElements.size());
        return entries;
    }
}
