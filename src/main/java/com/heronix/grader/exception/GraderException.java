package com.heronix.grader.exception;

/**
 * Base class for all fatal grading pipeline failures.
 */
public class GraderException extends RuntimeException {

    public GraderException(String message) {
        super(message);
    }

    public GraderException(String message, Throwable cause) {
        super(message, cause);
    }
}
