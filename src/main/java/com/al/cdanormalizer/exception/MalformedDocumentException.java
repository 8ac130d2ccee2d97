package com.al.cdanormalizer.exception;

import lombok.Getter;

/**
 * Thrown when the root content cannot be parsed as any recognised markup.
 */
@Getter
public class MalformedDocumentException extends RuntimeException {

    private final String contentHash;

    public MalformedDocumentException(String contentHash, String message, Throwable cause) {
        super(message, cause);
        this.contentHash = contentHash;
    }

    public MalformedDocumentException(String contentHash, String message) {
        this(contentHash, message, null);
    }
}
