package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.DocumentMap;
import com.al.cdanormalizer.model.DocumentMap.EntryPattern;
import com.al.cdanormalizer.model.DocumentMap.SectionProfile;
import com.al.cdanormalizer.model.EntryShape;
import com.al.cdanormalizer.service.extraction.EntryShapeClassifier;
import com.al.cdanormalizer.service.extraction.GenericStructuralParser;
import com.al.cdanormalizer.service.extraction.SectionNode;
import com.al.cdanormalizer.service.extraction.StructuralPaths;
import com.al.cdanormalizer.util.CdaXml;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a document map: profiles every section, classifies each entry's
 * shape and keeps, per entry, only the candidate paths that found data in
 * this document.
 */
@Component
@Slf4j
public class DocumentMapBuilder {

    private final GenericStructuralParser structuralParser;
    private final Clock clock;

    @Autowired
    public DocumentMapBuilder(GenericStructuralParser structuralParser) {
        this(structuralParser, Clock.systemUTC());
    }

    DocumentMapBuilder(GenericStructuralParser structuralParser, Clock clock) {
        this.structuralParser = structuralParser;
        this.clock = clock;
    }

    public DocumentMap build(String contentHash, Document dom, int maxEntriesPerSection) {
        DocumentMap.DocumentMapBuilder map = DocumentMap.builder()
                .contentHash(contentHash)
                .createdAt(Instant.now(clock))
                .metadata(readMetadata(dom));

        for (SectionNode node : structuralParser.findSections(dom)) {
            ClinicalCategory category = ClinicalCategory.resolve(node.getCode(), node.getTitle());
            SectionProfile.SectionProfileBuilder profile = SectionProfile.builder()
                    .sectionIndex(node.getIndex())
                    .code(node.getCode())
                    .title(node.getTitle())
                    .category(category)
                    .entryCount(node.getEntryElements().size());

            List<Element> entries = node.getEntryElements();
            int limit = maxEntriesPerSection > 0 ? Math.min(entries.size(), maxEntriesPerSection) : entries.size();
            for (int i = 0; i < limit; i++) {
                EntryShape shape = EntryShapeClassifier.classify(entries.get(i));
                profile.entryShape(shape);
                ClinicalCategory entryCategory = StructuralPaths.effectiveCategory(category, shape);
                Map<String, String> paths = observedPaths(entries.get(i), entryCategory);
                if (!paths.isEmpty()) {
                    profile.pattern(EntryPattern.builder()
                            .entryIndex(i)
                            .shape(shape)
                            .category(entryCategory)
                            .paths(paths)
                            .build());
                }
            }
            map.section(profile.build());
        }

        DocumentMap built = map.build();
        log.info("Built document map {}: {} sections, {} entry patterns", contentHash, built.getSections().size(),
                built.getPatternCount());
        return built;
    }

    private static Map<String, String> observedPaths(Element entry, ClinicalCategory category) {
        Map<String, String> paths = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> candidate : StructuralPaths.candidates(category).entrySet()) {
            GenericStructuralParser.firstMatch(entry, candidate.getValue())
                    .ifPresent(match -> paths.put(candidate.getKey(), match.getKey()));
        }
        return paths;
    }

    /**
     * Document id, type, realm and language read from the header.
     */
    static Map<String, String> readMetadata(Document dom) {
        Map<String, String> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "documentId", CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:id/@extension"));
        putIfPresent(metadata, "documentIdRoot", CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:id/@root"));
        putIfPresent(metadata, "documentTypeCode", CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:code/@code"));
        putIfPresent(metadata, "documentType", CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:code/@displayName"));
        putIfPresent(metadata, "realmCode", CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:realmCode/@code"));
        putIfPresent(metadata, "languageCode", CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:languageCode/@code"));
        return metadata;
    }

    private static void putIfPresent(Map<String, String> metadata, String key, String value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
