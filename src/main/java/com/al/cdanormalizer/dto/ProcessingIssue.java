package com.al.cdanormalizer.dto;

import com.al.cdanormalizer.model.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * A non-fatal (or, for malformed documents, fatal) issue recorded while
 * processing one document.
 */
@Value
@Builder
public class ProcessingIssue {

    /**
     * Kind of failure, from the pipeline's error taxonomy
     */
    ErrorKind kind;

    /**
     * Section code the issue relates to, if any
     */
    String sectionCode;

    /**
     * Human-readable message
     */
    String message;

    /**
     * Severity: ERROR, WARNING, INFORMATION
     */
    Severity severity;

    public enum Severity {
        ERROR,
        WARNING,
        INFORMATION
    }

    public static ProcessingIssue fatal(ErrorKind kind, String message) {
        return ProcessingIssue.builder()
                .kind(kind)
                .message(message)
                .severity(Severity.ERROR)
                .build();
    }

    public static ProcessingIssue warning(ErrorKind kind, String sectionCode, String message) {
        return ProcessingIssue.builder()
                .kind(kind)
                .sectionCode(sectionCode)
                .message(message)
                .severity(Severity.WARNING)
                .build();
    }

    public static ProcessingIssue info(ErrorKind kind, String sectionCode, String message) {
        return ProcessingIssue.builder()
                .kind(kind)
                .sectionCode(sectionCode)
                .message(message)
                .severity(Severity.INFORMATION)
                .build();
    }
}
