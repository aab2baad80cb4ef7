package com.heronix.grader.exception;

/**
 * Exception thrown when an input table does not carry the columns needed
 * to identify students (no name columns, no ID or email column) or when a
 * requested column does not exist.
 */
public class SchemaException extends GraderException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
