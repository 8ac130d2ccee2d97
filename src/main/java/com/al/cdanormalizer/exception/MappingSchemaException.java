package com.al.cdanormalizer.exception;

/**
 * The field mapping schema is missing or invalid. Raised at startup only.
 */
public class MappingSchemaException extends RuntimeException {

    public MappingSchemaException(String message) {
        super(message);
    }

    public MappingSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
