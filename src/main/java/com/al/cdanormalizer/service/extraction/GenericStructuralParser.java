package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.util.CdaXml;
import com.al.cdanormalizer.util.ExtractedValue;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema-free walk over a structured document: locates sections and reads
 * entries by their tree shape, falling back to the section's narrative table.
 */
@Component
@Slf4j
public class GenericStructuralParser {

    private final FieldValueFactory fieldValueFactory;

    public GenericStructuralParser(FieldValueFactory fieldValueFactory) {
        this.fieldValueFactory = fieldValueFactory;
    }

    /**
     * All sections of the document, nested ones included, in document order.
     */
    public List<SectionNode> findSections(Document dom) {
        List<SectionNode> sections = new ArrayList<>();
        List<Element> elements = CdaXml.elements(dom, "//hl7:section");
        for (int i = 0; i < elements.size(); i++) {
            sections.add(readSection(elements.get(i), i));
        }
        log.debug("Found {} sections", sections.size());
        return sections;
    }

    public SectionNode readSection(Element section, int index) {
        Element codeElement = CdaXml.children(section, "code").stream().findFirst().orElse(null);
        String code = codeElement != null ? CdaXml.attribute(codeElement, "code") : null;
        String codeSystem = codeElement != null ? CdaXml.attribute(codeElement, "codeSystem") : null;
        String title = CdaXml.children(section, "title").stream()
                .map(t -> StringUtils.trimToNull(StringUtils.normalizeSpace(t.getTextContent())))
                .filter(StringUtils::isNotBlank)
                .findFirst()
                .orElse(codeElement != null ? CdaXml.attribute(codeElement, "displayName") : null);
        return new SectionNode(section, index, code, codeSystem, title, CdaXml.children(section, "entry"));
    }

    /**
     * Structural walk of one section: one entry per {@code entry} element, read
     * with the candidate paths of its effective category. When no entry yields
     * anything, the narrative table is read instead.
     */
    public List<Entry> walkSection(SectionNode section, ClinicalCategory sectionCategory, ExtractionContext context) {
        List<Entry> entries = new ArrayList<>();
        List<Element> entryElements = limit(section.getEntryElements(), context);
        for (Element entryElement : entryElements) {
            ClinicalCategory category = StructuralPaths.effectiveCategory(sectionCategory,
                    EntryShapeClassifier.classify(entryElement));
            Map<String, FieldValue> fields = readCandidates(entryElement, category, context);
            if (!fields.isEmpty()) {
                entries.add(new Entry(category, fields));
            }
        }
        if (entries.isEmpty()) {
            entries.addAll(readNarrativeTable(section, sectionCategory, context));
        }
        return entries;
    }

    /**
     * Reads every label of the category using its first candidate path that yields a value.
     */
    Map<String, FieldValue> readCandidates(Element entryElement, ClinicalCategory category,
            ExtractionContext context) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> candidate : StructuralPaths.candidates(category).entrySet()) {
            firstMatch(entryElement, candidate.getValue())
                    .map(match -> fieldValueFactory.createStructural(candidate.getKey(), match.getValue(), context))
                    .ifPresent(value -> fields.put(candidate.getKey(), value));
        }
        return fields;
    }

    /**
     * First candidate path yielding a value, with the path that produced it.
     */
    public static Optional<Map.Entry<String, ExtractedValue>> firstMatch(Element entryElement, List<String> paths) {
        for (String path : paths) {
            Optional<ExtractedValue> value = CdaXml.readValue(entryElement, path);
            if (value.isPresent()) {
                return Optional.of(Map.entry(path, value.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * One entry per body row of the first table in the section narrative,
     * keyed by the header cells.
     */
    public List<Entry> readNarrativeTable(SectionNode section, ClinicalCategory category, ExtractionContext context) {
        Element table = CdaXml.firstElement(section.getElement(), "hl7:text//hl7:table");
        if (table == null) {
            return List.of();
        }
        List<String> headers = new ArrayList<>();
        for (Element th : CdaXml.elements(table, "(hl7:thead/hl7:tr)[1]/hl7:th | (hl7:tr)[1]/hl7:th")) {
            headers.add(StringUtils.normalizeSpace(th.getTextContent()));
        }
        List<Entry> entries = new ArrayList<>();
        List<Element> rows = limit(CdaXml.elements(table, "hl7:tbody/hl7:tr[hl7:td] | hl7:tr[hl7:td]"), context);
        for (Element row : rows) {
            List<Element> cells = CdaXml.elements(row, "hl7:td");
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            for (int i = 0; i < cells.size(); i++) {
                String label = FieldLabels.forColumn(i < headers.size() ? headers.get(i) : null, i, category);
                FieldValue value = fieldValueFactory.create(label,
                        ExtractedValue.text(StringUtils.normalizeSpace(cells.get(i).getTextContent())),
                        true, false, null, context);
                if (value != null) {
                    fields.putIfAbsent(label, value);
                }
            }
            if (!fields.isEmpty()) {
                entries.add(new Entry(category, fields));
            }
        }
        log.debug("Section {} read from narrative table: {} rows", section.getCode(), entries.size());
        return entries;
    }

    static <T> List<T> limit(List<T> items, ExtractionContext context) {
        int max = context.getMaxEntriesPerSection();
        return max > 0 && items.size() > max ? items.subList(0, max) : items;
    }
}
