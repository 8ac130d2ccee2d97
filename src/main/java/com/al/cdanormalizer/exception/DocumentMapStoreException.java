package com.al.cdanormalizer.exception;

/**
 * The document-map store could not be read or written.
 */
public class DocumentMapStoreException extends RuntimeException {

    public DocumentMapStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
