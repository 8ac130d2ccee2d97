package com.al.cdanormalizer.dto;

import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.ProcessingState;
import com.al.cdanormalizer.model.Section;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Normalized output of one document. Always returned, never thrown: a parse
 * failure is reported through {@link #isSuccess()} and {@link #getErrorDescription()}.
 */
@Value
@Builder
public class ProcessingResult {

    boolean success;

    @Singular
    List<Section> sections;

    int sectionsCount;
    int entriesCount;
    int medicalTermsCount;
    int codedSectionsCount;

    /**
     * Share of sections carrying a section code, 0-100
     */
    int codedPercentage;

    /**
     * Excellent, Good, Fair or Basic, from {@link #codedPercentage}
     */
    String translationQuality;

    ExtractionMethod extractionMethod;
    ProcessingState finalState;
    String contentHash;
    String sourceLanguage;
    String targetLanguage;

    /**
     * Populated only when {@link #success} is false
     */
    String errorDescription;

    @Singular
    List<ProcessingIssue> issues;

    @Singular("strategyAttempted")
    List<ExtractionMethod> strategiesAttempted;

    /**
     * Create a failed result with an error message
     */
    public static ProcessingResult failure(String errorDescription, List<ProcessingIssue> issues) {
        return ProcessingResult.builder()
                .success(false)
                .errorDescription(errorDescription)
                .extractionMethod(ExtractionMethod.NONE)
                .finalState(ProcessingState.FAILED)
                .translationQuality("Basic")
                .issues(issues)
                .build();
    }
}
