package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.dto.ProcessingIssue;
import com.al.cdanormalizer.model.ClinicalDocument;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.ProcessingState;
import lombok.Builder;
import lombok.Data;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-document state shared by the strategies of one run. Not shared across
 * threads.
 */
@Data
@Builder
public class ExtractionContext {

    private ClinicalDocument document;

    /** Parsed DOM; present for structured markup only. */
    private Document dom;

    /** Parsed HTML; present for rendered markup only. */
    private org.jsoup.nodes.Document html;

    private String targetLanguage;
    private String sourceLanguage;
    private String countryCode;

    @Builder.Default
    private int maxEntriesPerSection = 500;

    @Builder.Default
    private ProcessingState state = ProcessingState.UNPARSED;

    @Builder.Default
    private List<ProcessingIssue> issues = new ArrayList<>();

    public boolean isStructured() {
        return dom != null;
    }

    public boolean isRendered() {
        return html != null;
    }

    public void recordIssue(ErrorKind kind, String sectionCode, String message) {
        issues.add(kind.isFatal()
                ? ProcessingIssue.fatal(kind, message)
                : ProcessingIssue.warning(kind, sectionCode, message));
    }

    public void recordInfo(ErrorKind kind, String sectionCode, String message) {
        issues.add(ProcessingIssue.info(kind, sectionCode, message));
    }

    /**
     * Move to the next lifecycle state.
     *
     * @throws IllegalStateException on a transition the lifecycle does not allow
     */
    public void transitionTo(ProcessingState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal processing state transition " + state + " -> " + next);
        }
        state = next;
    }
}
