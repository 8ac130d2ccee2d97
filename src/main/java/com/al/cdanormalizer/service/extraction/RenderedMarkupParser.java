package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.FieldLabels;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.util.ExtractedValue;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads sections out of rendered markup: elements whose class mentions
 * "section", or else the content between consecutive h1-h4 headings. Tables
 * become one entry per row keyed by header; list items become text entries.
 */
@Component
@Slf4j
public class RenderedMarkupParser {

    private static final String HEADINGS = "h1, h2, h3, h4";

    private final FieldValueFactory fieldValueFactory;

    public RenderedMarkupParser(FieldValueFactory fieldValueFactory) {
        this.fieldValueFactory = fieldValueFactory;
    }

    public List<RenderedSection> findSections(Document html) {
        List<RenderedSection> sections = new ArrayList<>();
        Elements candidates = html.select("div[class*=section], section[class*=section]");
        // Only the outermost containers; nested ones are read as part of their parent.
        List<Element> containers = candidates.stream()
                .filter(container -> container.parents().stream().noneMatch(candidates::contains))
                .collect(Collectors.toList());
        if (!containers.isEmpty()) {
            for (Element container : containers) {
                Element heading = container.selectFirst(HEADINGS);
                String code = StringUtils.trimToNull(container.attr("data-code"));
                sections.add(new RenderedSection(code, heading != null ? heading.text() : null, container));
            }
        } else {
            for (Element heading : html.select(HEADINGS)) {
                Element body = new Element("div");
                for (Element sibling = heading.nextElementSibling(); sibling != null
                        && !sibling.is(HEADINGS); sibling = sibling.nextElementSibling()) {
                    body.appendChild(sibling.clone());
                }
                sections.add(new RenderedSection(null, heading.text(), body));
            }
        }
        log.debug("Found {} rendered sections", sections.size());
        return sections;
    }

    public List<Entry> readEntries(RenderedSection section, ClinicalCategory category, ExtractionContext context) {
        List<Entry> entries = new ArrayList<>();
        for (Element table : section.getBody().select("table")) {
            entries.addAll(readTable(table, category, context));
        }
        if (entries.isEmpty()) {
            for (Element item : section.getBody().select("li")) {
                FieldValue value = textValue(FieldLabels.TEXT, item.text(), context);
                if (value != null) {
                    entries.add(new Entry(category, Map.of(FieldLabels.TEXT, value)));
                }
            }
        }
        return GenericStructuralParser.limit(entries, context);
    }

    private List<Entry> readTable(Element table, ClinicalCategory category, ExtractionContext context) {
        List<String> headers = new ArrayList<>();
        Elements headerCells = table.select("thead th");
        if (headerCells.isEmpty()) {
            Element firstRow = table.selectFirst("tr:has(th)");
            headerCells = firstRow != null ? firstRow.select("th") : new Elements();
        }
        for (Element th : headerCells) {
            headers.add(th.text());
        }

        List<Entry> entries = new ArrayList<>();
        for (Element row : table.select("tr:has(td)")) {
            Elements cells = row.select("td");
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            for (int i = 0; i < cells.size(); i++) {
                String label = FieldLabels.forColumn(i < headers.size() ? headers.get(i) : null, i, category);
                FieldValue value = textValue(label, cells.get(i).text(), context);
                if (value != null) {
                    fields.putIfAbsent(label, value);
                }
            }
            if (!fields.isEmpty()) {
                entries.add(new Entry(category, fields));
            }
        }
        return entries;
    }

    private FieldValue textValue(String label, String text, ExtractionContext context) {
        return fieldValueFactory.create(label, ExtractedValue.text(text), true, false, null, context);
    }

    /**
     * A section located in rendered markup.
     */
    @Value
    public static class RenderedSection {
        String code;
        String title;
        Element body;
    }
}
