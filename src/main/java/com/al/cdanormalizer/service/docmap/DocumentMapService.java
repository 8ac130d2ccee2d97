package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.exception.DocumentMapStoreException;
import com.al.cdanormalizer.model.DocumentMap;
import com.al.cdanormalizer.model.DocumentMap.EntryPattern;
import com.al.cdanormalizer.model.DocumentMap.SectionProfile;
import com.al.cdanormalizer.model.Entry;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.FieldValue;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.service.ResultAssembler;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.extraction.FieldValueFactory;
import com.al.cdanormalizer.service.extraction.GenericStructuralParser;
import com.al.cdanormalizer.util.CdaXml;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Loads the document map for a content hash, building and storing it on first
 * encounter, and replays a map against a document.
 *
 * <p>
 * Builds are serialized per content hash; reads of stored maps are not. When
 * the store is unavailable the map is built in memory and not persisted.
 */
@Service
@Slf4j
public class DocumentMapService {

    private final DocumentMapStore store;
    private final DocumentMapBuilder builder;
    private final GenericStructuralParser structuralParser;
    private final FieldValueFactory fieldValueFactory;
    private final ResultAssembler resultAssembler;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, Object> buildLocks = new ConcurrentHashMap<>();

    public DocumentMapService(DocumentMapStore store, DocumentMapBuilder builder,
            GenericStructuralParser structuralParser, FieldValueFactory fieldValueFactory,
            ResultAssembler resultAssembler, MeterRegistry meterRegistry) {
        this.store = store;
        this.builder = builder;
        this.structuralParser = structuralParser;
        this.fieldValueFactory = fieldValueFactory;
        this.resultAssembler = resultAssembler;
        this.meterRegistry = meterRegistry;
    }

    public DocumentMap buildOrLoad(ExtractionContext context) {
        String hash = context.getDocument().getContentHash();
        try {
            Optional<DocumentMap> cached = store.get(hash);
            if (cached.isPresent()) {
                meterRegistry.counter("cda.document_map.cache", "result", "hit").increment();
                log.debug("Reusing document map {}", hash);
                return cached.get();
            }
            Object lock = buildLocks.computeIfAbsent(hash, k -> new Object());
            try {
                synchronized (lock) {
                    Optional<DocumentMap> builtMeanwhile = store.get(hash);
                    if (builtMeanwhile.isPresent()) {
                        meterRegistry.counter("cda.document_map.cache", "result", "hit").increment();
                        return builtMeanwhile.get();
                    }
                    meterRegistry.counter("cda.document_map.cache", "result", "miss").increment();
                    DocumentMap built = builder.build(hash, context.getDom(), context.getMaxEntriesPerSection());
                    return store.putIfAbsent(hash, built);
                }
            } finally {
                buildLocks.remove(hash, lock);
            }
        } catch (DocumentMapStoreException e) {
            log.warn("Document map store unavailable for {}, building in memory: {}", hash, e.getMessage());
            context.recordIssue(ErrorKind.CACHE_UNAVAILABLE, null, e.getMessage());
            meterRegistry.counter("cda.pipeline.issues", "kind", ErrorKind.CACHE_UNAVAILABLE.name()).increment();
            return builder.build(hash, context.getDom(), context.getMaxEntriesPerSection());
        }
    }

    /**
     * Replay the map's patterns against a document. Every profiled section is
     * emitted; entries whose recorded element or paths no longer match come out
     * empty and are dropped. Sections without patterns are read from their
     * narrative table.
     */
    public List<Section> extractUsingMap(DocumentMap map, ExtractionContext context) {
        Document dom = context.getDom();
        List<Element> sectionElements = CdaXml.elements(dom, "//hl7:section");
        List<Section> sections = new ArrayList<>();
        int drifted = 0;

        for (SectionProfile profile : map.getSections()) {
            Element sectionElement = profile.getSectionIndex() < sectionElements.size()
                    ? sectionElements.get(profile.getSectionIndex())
                    : null;
            List<Entry> entries = new ArrayList<>();
            if (sectionElement != null && sameCode(sectionElement, profile)) {
                List<Element> entryElements = CdaXml.children(sectionElement, "entry");
                for (EntryPattern pattern : profile.getPatterns()) {
                    Entry entry = replay(pattern, entryElements, context);
                    if (entry != null) {
                        entries.add(entry);
                    } else {
                        drifted++;
                    }
                }
                if (profile.getPatterns().isEmpty()) {
                    entries.addAll(structuralParser.readNarrativeTable(
                            structuralParser.readSection(sectionElement, profile.getSectionIndex()),
                            profile.getCategory(), context));
                }
            } else {
                drifted += profile.getPatterns().size();
            }
            sections.add(resultAssembler.buildSection(profile.getCode(), profile.getTitle(), profile.getCategory(),
                    entries, context));
        }
        if (drifted > 0) {
            log.info("Document map {}: {} entry patterns no longer match the document", map.getContentHash(),
                    drifted);
            context.recordInfo(ErrorKind.FIELD_EXTRACTION_MISS, null,
                    drifted + " recorded entry patterns did not match the document");
        }
        return sections;
    }

    private Entry replay(EntryPattern pattern, List<Element> entryElements, ExtractionContext context) {
        if (pattern.getEntryIndex() >= entryElements.size()) {
            return null;
        }
        Element entryElement = entryElements.get(pattern.getEntryIndex());
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> path : pattern.getPaths().entrySet()) {
            CdaXml.readValue(entryElement, path.getValue())
                    .map(value -> fieldValueFactory.createStructural(path.getKey(), value, context))
                    .ifPresent(value -> fields.put(path.getKey(), value));
        }
        return fields.isEmpty() ? null : new Entry(pattern.getCategory(), fields);
    }

    private static boolean sameCode(Element sectionElement, SectionProfile profile) {
        String code = CdaXml.children(sectionElement, "code").stream()
                .findFirst()
                .map(element -> CdaXml.attribute(element, "code"))
                .orElse(null);
        return Objects.equals(code, profile.getCode());
    }
}
