package com.heronix.grader.exception;

import java.util.Collection;

/**
 * Exception thrown when normalized data breaks a roster invariant:
 * students without an ID, duplicated IDs, or unreadable score cells.
 */
public class GradeValidationException extends GraderException {

    public GradeValidationException(String message) {
        super(message);
    }

    public GradeValidationException(String message, Collection<?> offending) {
        super(message + ": " + offending);
    }

    public GradeValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
