package com.al.cdanormalizer.service.docmap;

import com.al.cdanormalizer.model.DocumentMap;
import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.extraction.ExtractionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Extraction with the document-specific map. Yields nothing when the map
 * recorded no entry patterns, leaving the document to the next strategy.
 */
@Component
@Slf4j
public class DocumentMapStrategy implements ExtractionStrategy {

    private final DocumentMapService documentMapService;

    public DocumentMapStrategy(DocumentMapService documentMapService) {
        this.documentMapService = documentMapService;
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.DOCUMENT_MAP;
    }

    @Override
    public boolean supports(ExtractionContext context) {
        return context.isStructured();
    }

    @Override
    public List<Section> tryExtract(ExtractionContext context) {
        DocumentMap map = documentMapService.buildOrLoad(context);
        if (!map.hasPatterns()) {
            log.debug("Document map {} has no entry patterns", map.getContentHash());
            return List.of();
        }
        return documentMapService.extractUsingMap(map, context);
    }
}
