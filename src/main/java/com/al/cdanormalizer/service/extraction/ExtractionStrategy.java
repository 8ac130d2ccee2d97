package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.Section;

import java.util.List;

/**
 * One link of the extraction chain.
 */
public interface ExtractionStrategy {

    ExtractionMethod method();

    /**
     * Whether the strategy can run on this document at all (content kind, hints).
     */
    boolean supports(ExtractionContext context);

    /**
     * Extracts sections from the document.
     *
     * @param context per-document state; issues are recorded on it
     * @return sections found, possibly with no entries; empty when nothing applies
     */
    List<Section> tryExtract(ExtractionContext context);
}
